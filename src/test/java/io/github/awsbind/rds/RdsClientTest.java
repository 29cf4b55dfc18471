package io.github.awsbind.rds;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.*;

import org.junit.jupiter.api.Test;

import io.github.awsbind.MalformedResponseException;

public class RdsClientTest {

  private static final String DESCRIBE = String.join("\n",
      //
      "<DescribeDBInstancesResponse xmlns=\"http://rds.amazonaws.com/doc/2013-09-09/\">",
      "  <DescribeDBInstancesResult>",
      "    <DBInstances>",
      "      <DBInstance>",
      "        <BackupRetentionPeriod>7</BackupRetentionPeriod>",
      "        <MultiAZ>false</MultiAZ>",
      "        <DBInstanceStatus>available</DBInstanceStatus>",
      "        <DBInstanceIdentifier>mysqlexampledb</DBInstanceIdentifier>",
      "        <PreferredBackupWindow>10:07-10:37</PreferredBackupWindow>",
      "        <PreferredMaintenanceWindow>sun:03:35-sun:04:05</PreferredMaintenanceWindow>",
      "        <AvailabilityZone>us-east-1b</AvailabilityZone>",
      "        <ReadReplicaDBInstanceIdentifiers>",
      "          <ReadReplicaDBInstanceIdentifier>replica-1</ReadReplicaDBInstanceIdentifier>",
      "          <ReadReplicaDBInstanceIdentifier>replica-2</ReadReplicaDBInstanceIdentifier>",
      "        </ReadReplicaDBInstanceIdentifiers>",
      "        <Engine>mysql</Engine>",
      "        <PubliclyAccessible>true</PubliclyAccessible>",
      "        <AllocatedStorage>100</AllocatedStorage>",
      "        <VpcSecurityGroups>",
      "          <VpcSecurityGroupMembership><Status>active</Status><VpcSecurityGroupId>sg-1</VpcSecurityGroupId></VpcSecurityGroupMembership>",
      "        </VpcSecurityGroups>",
      "        <Endpoint>",
      "          <Port>3306</Port>",
      "          <Address>mysqlexampledb.c9zpgnjcnyvb.us-east-1.rds.amazonaws.com</Address>",
      "        </Endpoint>",
      "        <DBInstanceClass>db.m1.medium</DBInstanceClass>",
      "        <MasterUsername>root</MasterUsername>",
      "      </DBInstance>",
      "      <DBInstance>",
      "        <DBInstanceIdentifier>second</DBInstanceIdentifier>",
      "        <DBInstanceStatus>creating</DBInstanceStatus>",
      "      </DBInstance>",
      "    </DBInstances>",
      "    <Marker>next-page</Marker>",
      "  </DescribeDBInstancesResult>",
      "  <ResponseMetadata>",
      "    <RequestId>01b2685a-b978-11d3-f272-7cd6cce12cc5</RequestId>",
      "  </ResponseMetadata>",
      "</DescribeDBInstancesResponse>");

  private static final String CREATE = String.join("\n",
      //
      "<CreateDBInstanceResponse xmlns=\"http://rds.amazonaws.com/doc/2013-09-09/\">",
      "  <CreateDBInstanceResult>",
      "    <DBInstance>",
      "      <DBInstanceIdentifier>newdb</DBInstanceIdentifier>",
      "      <DBInstanceStatus>creating</DBInstanceStatus>",
      "      <Engine>mysql</Engine>",
      "      <AllocatedStorage>15</AllocatedStorage>",
      "    </DBInstance>",
      "  </CreateDBInstanceResult>",
      "  <ResponseMetadata><RequestId>req-create</RequestId></ResponseMetadata>",
      "</CreateDBInstanceResponse>");

  private static final String DELETE = String.join("\n",
      //
      "<DeleteDBInstanceResponse xmlns=\"http://rds.amazonaws.com/doc/2013-09-09/\">",
      "  <DeleteDBInstanceResult>",
      "    <DBInstance>",
      "      <DBInstanceIdentifier>olddb</DBInstanceIdentifier>",
      "      <DBInstanceStatus>deleting</DBInstanceStatus>",
      "    </DBInstance>",
      "  </DeleteDBInstanceResult>",
      "  <ResponseMetadata><RequestId>req-delete</RequestId></ResponseMetadata>",
      "</DeleteDBInstanceResponse>");

  private final List<Map<String, String>> calls = new ArrayList<>();
  private String response;

  private final RdsClient rds = new RdsClient(params -> {
    calls.add(new TreeMap<>(params));
    return response.getBytes(StandardCharsets.UTF_8);
  });

  @Test
  public void describeDBInstancesTest() {
    response = DESCRIBE;
    DescribeDBInstancesResponse result = rds.describeDBInstances("", 0, "");

    assertThat(calls).containsExactly(params("Action", "DescribeDBInstances", "Version", "2013-09-09"));
    assertThat(result.getRequestId()).isEqualTo("01b2685a-b978-11d3-f272-7cd6cce12cc5");
    assertThat(result.getMarker()).isEqualTo("next-page");
    assertThat(result.getDBInstances()).extracting(instance -> instance.dbInstanceIdentifier).containsExactly("mysqlexampledb", "second");

    DBInstance instance = result.getDBInstances().get(0);
    assertThat(instance.dbInstanceStatus).isEqualTo("available");
    assertThat(instance.allocatedStorage).isEqualTo(100);
    assertThat(instance.backupRetentionPeriod).isEqualTo(7);
    assertThat(instance.multiAZ).isFalse();
    assertThat(instance.publiclyAccessible).isTrue();
    assertThat(instance.endpoint.address).isEqualTo("mysqlexampledb.c9zpgnjcnyvb.us-east-1.rds.amazonaws.com");
    assertThat(instance.endpoint.port).isEqualTo(3306);
    assertThat(instance.readReplicaDBInstanceIdentifiers).containsExactly("replica-1", "replica-2");
  }

  @Test
  public void describeDBInstancesParamsTest() {
    response = DESCRIBE;
    rds.describeDBInstances("mydb", 20, "abc");
    assertThat(calls.get(0))
        //
        .containsEntry("DBInstanceIdentifier", "mydb")
        //
        .containsEntry("MaxRecords", "20")
        //
        .containsEntry("Marker", "abc");
  }

  @Test
  public void createDBInstanceTest() {
    response = CREATE;
    CreateDBInstanceOptions options = new CreateDBInstanceOptions();
    options.dbInstanceIdentifier = "newdb";
    options.dbInstanceClass = "db.m1.small";
    options.engine = "mysql";
    options.allocatedStorage = 15;
    options.masterUsername = "root";
    options.masterUserPassword = "secret";
    options.dbSecurityGroups.add("default");
    options.dbSecurityGroups.add("");
    options.dbSecurityGroups.add("web");
    options.vpcSecurityGroupIds.add("sg-1");

    CreateDBInstanceResponse result = rds.createDBInstance(options);
    assertThat(result.getRequestId()).isEqualTo("req-create");
    assertThat(result.getDBInstance().dbInstanceIdentifier).isEqualTo("newdb");
    assertThat(result.getDBInstance().allocatedStorage).isEqualTo(15);

    Map<String, String> params = calls.get(0);
    assertThat(params)
        //
        .containsEntry("Action", "CreateDBInstance")
        //
        .containsEntry("AllocatedStorage", "15")
        //
        .containsEntry("DBInstanceClass", "db.m1.small")
        //
        .containsEntry("DBSecurityGroups.member.1", "default")
        //
        .containsEntry("DBSecurityGroups.member.3", "web")
        //
        .containsEntry("VpcSecurityGroupIds.member.1", "sg-1")
        //
        .containsEntry("MultiAZ", "false")
        //
        .containsEntry("MasterUserPassword", "secret");
    // zero and empty values are not sent
    assertThat(params).doesNotContainKeys("DBSecurityGroups.member.2", "Iops", "Port", "DBName", "AvailabilityZone");
  }

  @Test
  public void deleteDBInstanceTest() {
    response = DELETE;
    DeleteDBInstanceResponse result = rds.deleteDBInstance("olddb", "", true);
    assertThat(result.getRequestId()).isEqualTo("req-delete");
    assertThat(result.getDBInstance().dbInstanceStatus).isEqualTo("deleting");
    assertThat(calls).containsExactly(params("Action", "DeleteDBInstance", "DBInstanceIdentifier", "olddb", "SkipFinalSnapshot", "true", "Version", "2013-09-09"));
  }

  @Test
  public void deleteDBInstanceFinalSnapshotTest() {
    response = DELETE;
    rds.deleteDBInstance("olddb", "olddb-final", false);
    assertThat(calls.get(0)).containsEntry("FinalDBSnapshotIdentifier", "olddb-final").containsEntry("SkipFinalSnapshot", "false");
  }

  @Test
  public void malformedTest() {
    response = "not xml";
    MalformedResponseException e = assertThrows(MalformedResponseException.class, () -> {
      rds.describeDBInstances("", 0, "");
    });
    assertThat(e.getFragment()).isEqualTo("not xml");
  }

  // sorted, like the captured calls
  private static Map<String, String> params(String... keysAndValues) {
    Map<String, String> params = new TreeMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2)
      params.put(keysAndValues[i], keysAndValues[i + 1]);
    return params;
  }

}
