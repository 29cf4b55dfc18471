package io.github.awsbind.rds;

import java.util.ArrayList;
import java.util.List;

/**
 * CreateDBInstanceOptions
 *
 * <p>empty strings and zeros are left out of the request
 */
// https://docs.aws.amazon.com/AmazonRDS/latest/APIReference/API_CreateDBInstance.html
public class CreateDBInstanceOptions {
  public int allocatedStorage; // gigabytes
  public boolean autoMinorVersionUpgrade;
  public String availabilityZone;
  public int backupRetentionPeriod; // days
  public String characterSetName;
  public String dbInstanceClass;
  public String dbInstanceIdentifier;
  public String dbName;
  public String dbParameterGroupName;
  public final List<String> dbSecurityGroups = new ArrayList<>();
  public String dbSubnetGroupName;
  public String engine;
  public String engineVersion;
  public int iops;
  public String licenseModel;
  public String masterUserPassword;
  public String masterUsername;
  public boolean multiAZ;
  public String optionGroupName;
  public int port;
  public String preferredBackupWindow;
  public String preferredMaintenanceWindow;
  public boolean publiclyAccessible;
  public final List<String> vpcSecurityGroupIds = new ArrayList<>();
}
