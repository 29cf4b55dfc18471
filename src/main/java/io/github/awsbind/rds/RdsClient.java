package io.github.awsbind.rds;

import java.util.Map;

import helpers.LogHelper;
import io.github.awsbind.transport.*;

/**
 * RdsClient
 *
 * <p>typed options to query parameters, xml response to typed result
 */
// https://docs.aws.amazon.com/AmazonRDS/latest/APIReference/Welcome.html
public class RdsClient extends XmlQueryClient {

  public static final String API_VERSION = "2013-09-09";

  public RdsClient(QueryTransport transport) {
    super(transport, API_VERSION);
    debug("ctor", transport);
  }

  /**
   * describeDBInstances
   * 
   * @param id instance identifier, empty for all
   * @param maxRecords page size, 0 for the service default
   * @param marker from a previous page, empty for the first
   */
  public DescribeDBInstancesResponse describeDBInstances(String id, int maxRecords, String marker) {
    Map<String, String> params = makeParams("DescribeDBInstances");
    putString(params, "DBInstanceIdentifier", id);
    putInt(params, "MaxRecords", maxRecords);
    putString(params, "Marker", marker);
    return query(params, DescribeDBInstancesResponse.class);
  }

  public CreateDBInstanceResponse createDBInstance(CreateDBInstanceOptions options) {
    Map<String, String> params = makeParams("CreateDBInstance");
    putInt(params, "AllocatedStorage", options.allocatedStorage);
    params.put("AutoMinorVersionUpgrade", String.valueOf(options.autoMinorVersionUpgrade));
    putString(params, "AvailabilityZone", options.availabilityZone);
    putInt(params, "BackupRetentionPeriod", options.backupRetentionPeriod);
    putString(params, "CharacterSetName", options.characterSetName);
    putString(params, "DBInstanceClass", options.dbInstanceClass);
    putString(params, "DBInstanceIdentifier", options.dbInstanceIdentifier);
    putString(params, "DBName", options.dbName);
    putString(params, "DBParameterGroupName", options.dbParameterGroupName);
    putList(params, "DBSecurityGroups", options.dbSecurityGroups);
    putString(params, "DBSubnetGroupName", options.dbSubnetGroupName);
    putString(params, "Engine", options.engine);
    putString(params, "EngineVersion", options.engineVersion);
    putInt(params, "Iops", options.iops);
    putString(params, "LicenseModel", options.licenseModel);
    putString(params, "MasterUserPassword", options.masterUserPassword);
    putString(params, "MasterUsername", options.masterUsername);
    params.put("MultiAZ", String.valueOf(options.multiAZ));
    putString(params, "OptionGroupName", options.optionGroupName);
    putInt(params, "Port", options.port);
    putString(params, "PreferredBackupWindow", options.preferredBackupWindow);
    putString(params, "PreferredMaintenanceWindow", options.preferredMaintenanceWindow);
    params.put("PubliclyAccessible", String.valueOf(options.publiclyAccessible));
    putList(params, "VpcSecurityGroupIds", options.vpcSecurityGroupIds);
    return query(params, CreateDBInstanceResponse.class);
  }

  /**
   * deleteDBInstance
   * 
   * <p>automated backups go with the instance; manual snapshots stay
   */
  public DeleteDBInstanceResponse deleteDBInstance(String id, String finalDBSnapshotIdentifier, boolean skipFinalSnapshot) {
    Map<String, String> params = makeParams("DeleteDBInstance");
    params.put("DBInstanceIdentifier", id);
    putString(params, "FinalDBSnapshotIdentifier", finalDBSnapshotIdentifier);
    params.put("SkipFinalSnapshot", String.valueOf(skipFinalSnapshot));
    return query(params, DeleteDBInstanceResponse.class);
  }

  private void debug(Object... args) {
    new LogHelper(this).debug(args);
  }

}
