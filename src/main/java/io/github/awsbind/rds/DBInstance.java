package io.github.awsbind.rds;

import java.util.*;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.dataformat.xml.annotation.*;
import com.google.gson.Gson;

/**
 * DBInstance
 *
 * <p>the commonly used subset of a database instance description; other elements are ignored
 */
// https://docs.aws.amazon.com/AmazonRDS/latest/APIReference/API_DBInstance.html
@JsonIgnoreProperties(ignoreUnknown = true)
public class DBInstance {
  @JsonProperty("DBInstanceIdentifier")
  public String dbInstanceIdentifier;
  @JsonProperty("DBInstanceClass")
  public String dbInstanceClass;
  @JsonProperty("DBInstanceStatus")
  public String dbInstanceStatus;
  @JsonProperty("DBName")
  public String dbName;
  @JsonProperty("Engine")
  public String engine;
  @JsonProperty("EngineVersion")
  public String engineVersion;
  @JsonProperty("MasterUsername")
  public String masterUsername;
  @JsonProperty("AllocatedStorage")
  public int allocatedStorage;
  @JsonProperty("AvailabilityZone")
  public String availabilityZone;
  @JsonProperty("BackupRetentionPeriod")
  public int backupRetentionPeriod;
  @JsonProperty("InstanceCreateTime")
  public String instanceCreateTime;
  @JsonProperty("LicenseModel")
  public String licenseModel;
  @JsonProperty("MultiAZ")
  public boolean multiAZ;
  @JsonProperty("PubliclyAccessible")
  public boolean publiclyAccessible;
  @JsonProperty("AutoMinorVersionUpgrade")
  public boolean autoMinorVersionUpgrade;
  @JsonProperty("PreferredBackupWindow")
  public String preferredBackupWindow;
  @JsonProperty("PreferredMaintenanceWindow")
  public String preferredMaintenanceWindow;
  @JsonProperty("Endpoint")
  public Endpoint endpoint;
  @JacksonXmlElementWrapper(localName = "ReadReplicaDBInstanceIdentifiers")
  @JacksonXmlProperty(localName = "ReadReplicaDBInstanceIdentifier")
  public List<String> readReplicaDBInstanceIdentifiers = new ArrayList<>();

  public String toString() {
    return new Gson().toJson(this);
  }
}
