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

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.KeeperException.Code;
import org.apache.zookeeper.Watcher;
import org.apache.zookeeper.ZooKeeper;
import org.apache.zookeeper.data.ACL;
import org.apache.zookeeper.data.Stat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A ZooKeeper handle that retries calls failing with connection loss for as
 * long as the session could still be alive, and logs every call at debug.
 */
public class ZooKeeperClient extends ZooKeeper {

  private static final Logger LOG = LoggerFactory.getLogger(ZooKeeperClient.class);
  private final int internalSessionTimeout;

  public ZooKeeperClient(String connectString, int sessionTimeout, Watcher watcher) throws IOException {
    super(connectString, sessionTimeout, watcher);
    internalSessionTimeout = sessionTimeout;
  }

  static abstract class ZKExecutor<T> {
    String _name;
    boolean _connectionLost;

    ZKExecutor(String name) {
      _name = name;
    }

    abstract T execute() throws KeeperException, InterruptedException;
  }

  public <T> T execute(ZKExecutor<T> executor) throws KeeperException, InterruptedException {
    final long timestamp = System.currentTimeMillis();
    int sessionTimeout = getSessionTimeout();
    if (sessionTimeout == 0) {
      sessionTimeout = internalSessionTimeout;
    }
    while (true) {
      try {
        return executor.execute();
      } catch (KeeperException e) {
        if (e.code() == Code.CONNECTIONLOSS && timestamp + sessionTimeout >= System.currentTimeMillis()) {
          LOG.warn("Connection loss during {}, retrying", executor._name);
          executor._connectionLost = true;
          pause();
          continue;
        }
        throw e;
      }
    }
  }

  @Override
  public String create(final String path, final byte[] data, final List<ACL> acl, final CreateMode createMode) throws KeeperException, InterruptedException {
    return execute(new CreateExecutor(path, data, acl, createMode));
  }

  /**
   * A create whose reply can be lost after the server applied it. The retry
   * then fails with NODEEXISTS; if the node is not sequential and holds
   * exactly the data written, it is the node this call created.
   */
  class CreateExecutor extends ZKExecutor<String> {
    final String _path;
    final byte[] _data;
    final List<ACL> _acl;
    final CreateMode _createMode;

    CreateExecutor(String path, byte[] data, List<ACL> acl, CreateMode createMode) {
      super("create");
      _path = path;
      _data = data;
      _acl = acl;
      _createMode = createMode;
    }

    @Override
    String execute() throws KeeperException, InterruptedException {
      try {
        return doCreate();
      } catch (KeeperException e) {
        if (e.code() == Code.NODEEXISTS && _connectionLost && !_createMode.isSequential() && _data != null
            && Arrays.equals(_data, ZooKeeperClient.super.getData(_path, false, null))) {
          LOG.info("Node {} already holds the data written before the connection loss, taking it as created", _path);
          return _path;
        }
        throw e;
      }
    }

    String doCreate() throws KeeperException, InterruptedException {
      LOG.debug("ZK Call - create [{}] [{}]", _path, _createMode);
      return ZooKeeperClient.super.create(_path, _data, _acl, _createMode);
    }
  }

  @Override
  public void delete(final String path, final int version) throws InterruptedException, KeeperException {
    execute(new ZKExecutor<Void>("delete") {
      @Override
      Void execute() throws KeeperException, InterruptedException {
        LOG.debug("ZK Call - delete [{}] [{}]", path, version);
        ZooKeeperClient.super.delete(path, version);
        return null;
      }
    });
  }

  @Override
  public Stat exists(final String path, final boolean watch) throws KeeperException, InterruptedException {
    return execute(new ZKExecutor<Stat>("exists") {
      @Override
      Stat execute() throws KeeperException, InterruptedException {
        LOG.debug("ZK Call - exists [{}] [{}]", path, watch);
        return ZooKeeperClient.super.exists(path, watch);
      }
    });
  }

  @Override
  public byte[] getData(final String path, final boolean watch, final Stat stat) throws KeeperException, InterruptedException {
    return execute(new ZKExecutor<byte[]>("getData") {
      @Override
      byte[] execute() throws KeeperException, InterruptedException {
        LOG.debug("ZK Call - getData [{}] [{}]", path, watch);
        return ZooKeeperClient.super.getData(path, watch, stat);
      }
    });
  }

  @Override
  public Stat setData(final String path, final byte[] data, final int version) throws KeeperException, InterruptedException {
    return execute(new ZKExecutor<Stat>("setData") {
      @Override
      Stat execute() throws KeeperException, InterruptedException {
        LOG.debug("ZK Call - setData [{}] [{}]", path, version);
        return ZooKeeperClient.super.setData(path, data, version);
      }
    });
  }

  @Override
  public List<String> getChildren(final String path, final boolean watch) throws KeeperException, InterruptedException {
    return execute(new ZKExecutor<List<String>>("getChildren") {
      @Override
      List<String> execute() throws KeeperException, InterruptedException {
        LOG.debug("ZK Call - getChildren [{}] [{}]", path, watch);
        return ZooKeeperClient.super.getChildren(path, watch);
      }

      @Override
      public String toString() {
        return "path=" + path + " watch=" + watch;
      }
    });
  }

  private void pause() throws InterruptedException {
    synchronized (this) {
      this.wait(TimeUnit.SECONDS.toMillis(1));
    }
  }
}
