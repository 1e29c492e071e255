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
import java.util.List;

import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.KeeperException.Code;
import org.apache.zookeeper.ZooDefs.Ids;
import org.apache.zookeeper.ZooKeeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import roster.store.CreateResult;
import roster.store.ObjectStoreRepo;

/**
 * Keeps the namespace in ZooKeeper through a plain {@link ZooKeeper} handle,
 * normally a {@link ZooKeeperClient}. Same layout as the Curator backed repo:
 * the namespace is a persistent znode, records are its children and derived
 * artifacts are the records' children.
 */
public class ZooKeeperObjectStoreRepo implements ObjectStoreRepo {
  private static final Logger LOG = LoggerFactory.getLogger(ZooKeeperObjectStoreRepo.class);

  private final ZooKeeper _zooKeeper;
  private final String _path;
  private final boolean _ownsZooKeeper;

  public ZooKeeperObjectStoreRepo(ZooKeeper zooKeeper, String path, boolean ownsZooKeeper) {
    if (path == null || path.length() < 2 || !path.startsWith("/") || path.endsWith("/")) {
      throw new IllegalArgumentException("Namespace path must be absolute, below the root and without a trailing slash, got \"" + path + "\".");
    }
    _zooKeeper = zooKeeper;
    _path = path;
    _ownsZooKeeper = ownsZooKeeper;
  }

  @Override
  public void ensureNamespace() throws IOException {
    int index = 0;
    while (index >= 0) {
      index = _path.indexOf('/', index + 1);
      tryToCreate(index < 0 ? _path : _path.substring(0, index));
    }
  }

  private void tryToCreate(String path) throws IOException {
    try {
      if (_zooKeeper.exists(path, false) == null) {
        _zooKeeper.create(path, null, Ids.OPEN_ACL_UNSAFE, CreateMode.PERSISTENT);
      }
    } catch (KeeperException e) {
      if (e.code() != Code.NODEEXISTS) {
        throw new IOException(e);
      }
      // another instance beat us to creating
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException(e);
    }
  }

  @Override
  public List<String> listRecordNames() throws IOException {
    try {
      return _zooKeeper.getChildren(_path, false);
    } catch (KeeperException e) {
      throw new IOException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException(e);
    }
  }

  @Override
  public CreateResult createRecord(String name, byte[] content, boolean overwrite) throws IOException {
    String path = _path + "/" + name;
    try {
      try {
        _zooKeeper.create(path, content, Ids.OPEN_ACL_UNSAFE, CreateMode.PERSISTENT);
        return CreateResult.CREATED;
      } catch (KeeperException e) {
        if (e.code() != Code.NODEEXISTS) {
          throw new IOException(e);
        }
        if (!overwrite) {
          LOG.debug(hashCode() + " Record " + path + " already exists");
          return CreateResult.ALREADY_EXISTS;
        }
      }
      _zooKeeper.setData(path, content, -1);
      return CreateResult.CREATED;
    } catch (KeeperException e) {
      throw new IOException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException(e);
    }
  }

  @Override
  public void deleteRecord(String name, boolean includeDerived) throws IOException {
    String path = _path + "/" + name;
    try {
      if (includeDerived) {
        rmr(path);
      } else {
        deleteIfExists(path);
      }
    } catch (KeeperException e) {
      throw new IOException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException(e);
    }
  }

  private void rmr(String path) throws KeeperException, InterruptedException {
    List<String> children;
    try {
      children = _zooKeeper.getChildren(path, false);
    } catch (KeeperException e) {
      if (e.code() == Code.NONODE) {
        return;
      }
      throw e;
    }
    for (String s : children) {
      rmr(path + "/" + s);
    }
    deleteIfExists(path);
  }

  private void deleteIfExists(String path) throws KeeperException, InterruptedException {
    try {
      _zooKeeper.delete(path, -1);
    } catch (KeeperException e) {
      if (e.code() != Code.NONODE) {
        throw e;
      }
      LOG.debug(hashCode() + " Record " + path + " was already absent");
    }
  }

  @Override
  public void close() throws IOException {
    if (_ownsZooKeeper) {
      try {
        _zooKeeper.close();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException(e);
      }
    }
  }
}
