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
package roster.store.curator;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

import org.apache.curator.RetryLoop;
import org.apache.curator.framework.CuratorFramework;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException.ConnectionLossException;
import org.apache.zookeeper.KeeperException.NoNodeException;
import org.apache.zookeeper.KeeperException.NodeExistsException;
import org.apache.zookeeper.ZooDefs.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import roster.store.CreateResult;
import roster.store.ObjectStoreRepo;

/**
 * Keeps the namespace in ZooKeeper through Curator. The namespace is a
 * persistent znode, each record a persistent child of it, and the derived
 * artifacts of a record are that record's own children.
 */
public class CuratorObjectStoreRepo implements ObjectStoreRepo {
  private static final Logger LOG = LoggerFactory.getLogger(CuratorObjectStoreRepo.class);
  private static final char PATH_SEPARATOR_CHAR = '/';
  private static final byte[] EMPTY = new byte[0];

  private final CuratorFramework client;
  private final String namespacePath;
  private final boolean ownsClient;

  /**
   * @param client
   *          a started client
   * @param namespacePath
   *          absolute path of the namespace znode
   * @param ownsClient
   *          whether {@link #close()} should close the client as well
   */
  public CuratorObjectStoreRepo(CuratorFramework client, String namespacePath, boolean ownsClient) {
    if (namespacePath == null || namespacePath.length() < 2 || namespacePath.charAt(0) != PATH_SEPARATOR_CHAR
        || namespacePath.charAt(namespacePath.length() - 1) == PATH_SEPARATOR_CHAR) {
      throw new IllegalArgumentException("Namespace path must be absolute, below the root and without a trailing slash, got \"" + namespacePath + "\".");
    }
    this.client = client;
    this.namespacePath = namespacePath;
    this.ownsClient = ownsClient;
  }

  public String getNamespacePath() {
    return this.namespacePath;
  }

  @Override
  public void ensureNamespace() throws IOException {
    try {
      this.client.create().creatingParentsIfNeeded().withMode(CreateMode.PERSISTENT).forPath(this.namespacePath, EMPTY);
      LOG.debug("Created namespace {}", this.namespacePath);
    } catch (NodeExistsException e) {
      // ignore
    } catch (Exception e) {
      throw wrap("ensure namespace " + this.namespacePath, e);
    }
  }

  @Override
  public List<String> listRecordNames() throws IOException {
    try {
      return this.client.getChildren().forPath(this.namespacePath);
    } catch (Exception e) {
      throw wrap("list " + this.namespacePath, e);
    }
  }

  /**
   * Creates the record unless it exists. A create retried after a connection
   * loss may find the node its earlier attempt created; a node holding exactly
   * {@code content} then counts as created here rather than as someone else's
   * record.
   */
  @Override
  public CreateResult createRecord(String name, final byte[] content, boolean overwrite) throws IOException {
    final String path = recordPath(name);
    try {
      final boolean[] connectionLost = new boolean[1];
      CreateResult result = RetryLoop.callWithRetry(this.client.getZookeeperClient(), new Callable<CreateResult>() {
        @Override
        public CreateResult call() throws Exception {
          try {
            createNode(path, content);
            return CreateResult.CREATED;
          } catch (ConnectionLossException e) {
            connectionLost[0] = true;
            throw e;
          } catch (NodeExistsException e) {
            if (connectionLost[0] && Arrays.equals(content, client.getData().forPath(path))) {
              LOG.info("Record {} already holds the content written before the connection loss, taking it as created", path);
              return CreateResult.CREATED;
            }
            return CreateResult.ALREADY_EXISTS;
          }
        }
      });
      if (result == CreateResult.CREATED) {
        return result;
      }
      if (!overwrite) {
        LOG.debug("Record {} already exists", path);
        return result;
      }
    } catch (Exception e) {
      throw wrap("create " + path, e);
    }
    try {
      this.client.setData().forPath(path, content);
      return CreateResult.CREATED;
    } catch (Exception e) {
      throw wrap("overwrite " + path, e);
    }
  }

  @Override
  public void deleteRecord(String name, boolean includeDerived) throws IOException {
    String path = recordPath(name);
    try {
      if (includeDerived) {
        this.client.delete().deletingChildrenIfNeeded().forPath(path);
      } else {
        this.client.delete().forPath(path);
      }
      LOG.debug("Deleted {}", path);
    } catch (NoNodeException e) {
      LOG.debug("Record {} was already absent", path);
    } catch (Exception e) {
      throw wrap("delete " + path, e);
    }
  }

  @Override
  public void close() {
    if (this.ownsClient) {
      this.client.close();
    }
  }

  /**
   * One create attempt straight on the current ZooKeeper handle; retries are
   * left to {@link #createRecord(String, byte[], boolean)}.
   */
  void createNode(String path, byte[] content) throws Exception {
    this.client.getZookeeperClient().getZooKeeper().create(path, content, Ids.OPEN_ACL_UNSAFE, CreateMode.PERSISTENT);
  }

  private String recordPath(String name) {
    return this.namespacePath + PATH_SEPARATOR_CHAR + name;
  }

  private static IOException wrap(String operation, Exception e) {
    if (e instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    return new IOException("ZooKeeper failed to " + operation + ".", e);
  }
}
