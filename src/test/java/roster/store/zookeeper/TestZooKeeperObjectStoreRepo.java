/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package roster.store.zookeeper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.curator.test.TestingServer;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.KeeperException.ConnectionLossException;
import org.apache.zookeeper.WatchedEvent;
import org.apache.zookeeper.Watcher;
import org.apache.zookeeper.Watcher.Event.KeeperState;
import org.apache.zookeeper.ZooDefs.Ids;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import roster.store.CreateResult;

public class TestZooKeeperObjectStoreRepo {
  private static final String PATH = "/roster/deep/test";

  private TestingServer server = null;
  private ZooKeeperClient zk = null;
  private ZooKeeperObjectStoreRepo repo = null;

  @Before
  public void setup() throws Exception {
    this.server = new TestingServer(true);
    final CountDownLatch connected = new CountDownLatch(1);
    this.zk = new ZooKeeperClient(this.server.getConnectString(), 10000, new Watcher() {
      @Override
      public void process(WatchedEvent event) {
        if (event.getState() == KeeperState.SyncConnected) {
          connected.countDown();
        }
      }
    });
    assertTrue(connected.await(30, TimeUnit.SECONDS));
    this.repo = new ZooKeeperObjectStoreRepo(this.zk, PATH, true);
  }

  @After
  public void tearDown() throws Exception {
    if (this.repo != null) {
      this.repo.close();
    }
    if (this.server != null) {
      this.server.close();
    }
  }

  @Test
  public void testEnsureNamespaceCreatesParents() throws Exception {
    this.repo.ensureNamespace();
    this.repo.ensureNamespace();
    assertTrue(this.zk.exists("/roster/deep", false) != null);
    assertTrue(this.repo.listRecordNames().isEmpty());
  }

  @Test
  public void testConditionalCreate() throws Exception {
    this.repo.ensureNamespace();
    assertEquals(CreateResult.CREATED, this.repo.createRecord("5", "a".getBytes("UTF-8"), false));
    assertEquals(CreateResult.ALREADY_EXISTS, this.repo.createRecord("5", "b".getBytes("UTF-8"), false));
    assertArrayEquals("a".getBytes("UTF-8"), this.zk.getData(PATH + "/5", false, null));
    assertEquals(CreateResult.CREATED, this.repo.createRecord("5", "c".getBytes("UTF-8"), true));
    assertArrayEquals("c".getBytes("UTF-8"), this.zk.getData(PATH + "/5", false, null));
    assertEquals(1, this.repo.listRecordNames().size());
  }

  @Test
  public void testCreateWithoutNamespaceFails() {
    try {
      this.repo.createRecord("1", new byte[0], false);
      fail("Expected a create under a missing namespace to fail");
    } catch (IOException e) {
      // expected
    }
  }

  @Test
  public void testDeleteWithDerivedArtifacts() throws Exception {
    this.repo.ensureNamespace();
    this.repo.createRecord("1", new byte[0], false);
    this.repo.createRecord("2", new byte[0], false);
    this.zk.create(PATH + "/1/snapshot", null, Ids.OPEN_ACL_UNSAFE, CreateMode.PERSISTENT);
    this.zk.create(PATH + "/1/snapshot/nested", null, Ids.OPEN_ACL_UNSAFE, CreateMode.PERSISTENT);

    try {
      this.repo.deleteRecord("1", false);
      fail("Expected a record with children not to be deleted without them");
    } catch (IOException e) {
      // expected
    }
    this.repo.deleteRecord("1", true);
    assertNull(this.zk.exists(PATH + "/1", false));
    assertTrue(this.zk.exists(PATH + "/2", false) != null);

    this.repo.deleteRecord("1", true);
    this.repo.deleteRecord("1", false);
  }

  private ZooKeeperClient.CreateExecutor replyLostAfterFirstAttempt(String path, byte[] data, final boolean applyFirstAttempt) {
    return this.zk.new CreateExecutor(path, data, Ids.OPEN_ACL_UNSAFE, CreateMode.PERSISTENT) {
      int attempts = 0;

      @Override
      String doCreate() throws KeeperException, InterruptedException {
        attempts++;
        if (attempts == 1) {
          if (applyFirstAttempt) {
            super.doCreate();
          }
          throw new ConnectionLossException();
        }
        return super.doCreate();
      }
    };
  }

  @Test
  public void testCreateAppliedBeforeConnectionLossCountsAsOwn() throws Exception {
    this.repo.ensureNamespace();
    String path = PATH + "/7";
    byte[] data = "mine".getBytes("UTF-8");

    assertEquals(path, this.zk.execute(replyLostAfterFirstAttempt(path, data, true)));
    assertArrayEquals(data, this.zk.getData(path, false, null));
  }

  @Test
  public void testNodeOfAnotherWriterAfterConnectionLossStillConflicts() throws Exception {
    this.repo.ensureNamespace();
    String path = PATH + "/7";
    this.zk.create(path, "theirs".getBytes("UTF-8"), Ids.OPEN_ACL_UNSAFE, CreateMode.PERSISTENT);

    try {
      this.zk.execute(replyLostAfterFirstAttempt(path, "mine".getBytes("UTF-8"), false));
      fail("Expected the existing node to be reported");
    } catch (KeeperException e) {
      assertEquals(KeeperException.Code.NODEEXISTS, e.code());
    }
    assertArrayEquals("theirs".getBytes("UTF-8"), this.zk.getData(path, false, null));
  }

  @Test
  public void testIdenticalNodeWithoutConnectionLossStillConflicts() throws Exception {
    this.repo.ensureNamespace();
    assertEquals(CreateResult.CREATED, this.repo.createRecord("8", "same".getBytes("UTF-8"), false));
    assertEquals(CreateResult.ALREADY_EXISTS, this.repo.createRecord("8", "same".getBytes("UTF-8"), false));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTrailingSlashIsRejected() {
    new ZooKeeperObjectStoreRepo(this.zk, "/roster/", false);
  }
}
