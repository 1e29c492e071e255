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
package roster.source;

import java.io.IOException;
import java.util.Properties;

import org.apache.curator.framework.CuratorFramework;
import org.apache.zookeeper.WatchedEvent;
import org.apache.zookeeper.Watcher;

import roster.RosterException;
import roster.config.RosterConfigException;
import roster.config.Settings;
import roster.lifecycle.FailureHandler;
import roster.lifecycle.JvmShutdownNotifier;
import roster.lifecycle.ShutdownNotifier;
import roster.store.ObjectStoreRepo;
import roster.store.curator.CuratorFrameworkFactory;
import roster.store.curator.CuratorObjectStoreRepo;
import roster.store.memory.InMemoryObjectStoreRepo;
import roster.store.zookeeper.ZooKeeperClient;
import roster.store.zookeeper.ZooKeeperObjectStoreRepo;

/**
 * Builds an {@link ApplicationInstanceIdSource} from configuration properties.
 */
public final class ApplicationInstanceIdSources {

  public static final String STORE_TYPE_KEY = "roster.store.type";
  public static final String APPLICATION_NAME_KEY = "roster.application.name";
  public static final String ZK_CONNECT_KEY = "roster.zk.connect";
  public static final String ZK_PATH_KEY = "roster.zk.path";
  public static final String ZK_SESSION_TIMEOUT_KEY = "roster.zk.session.timeout.ms";
  public static final String CURATOR_BASE_SLEEP_KEY = "roster.curator.base.sleep.ms";
  public static final String CURATOR_MAX_RETRIES_KEY = "roster.curator.max.retries";
  public static final String FIXED_ID_KEY = "roster.fixed.id";
  public static final String REGISTER_SHUTDOWN_HOOK_KEY = "roster.register.shutdown.hook";

  public static final String STORE_TYPE_CURATOR = "curator";
  public static final String STORE_TYPE_ZOOKEEPER = "zookeeper";
  public static final String STORE_TYPE_MEMORY = "memory";
  public static final String STORE_TYPE_FIXED = "fixed";

  static final int DEFAULT_SESSION_TIMEOUT_MS = 10000;
  static final int DEFAULT_BASE_SLEEP_MS = 1000;
  static final int DEFAULT_MAX_RETRIES = 3;

  private ApplicationInstanceIdSources() {
  }

  /**
   * Builds a source registered with the JVM shutdown hook unless
   * {@value #REGISTER_SHUTDOWN_HOOK_KEY} is false.
   */
  public static ApplicationInstanceIdSource fromProperties(Properties config) throws RosterException {
    return fromProperties(config, null, null);
  }

  /**
   * @param config
   *          the configuration
   * @param shutdownNotifier
   *          overrides the JVM shutdown hook when not null
   * @param failureHandler
   *          receives release failures, may be null
   */
  public static ApplicationInstanceIdSource fromProperties(Properties config, ShutdownNotifier shutdownNotifier, FailureHandler failureHandler)
      throws RosterException {
    String type = Settings.getRequired(config, STORE_TYPE_KEY, "instance id store type");

    boolean registerShutdownHook = Settings.getBoolean(config, REGISTER_SHUTDOWN_HOOK_KEY, true);
    ShutdownNotifier notifier = shutdownNotifier;
    if (notifier == null && registerShutdownHook) {
      notifier = new JvmShutdownNotifier();
    }

    if (STORE_TYPE_FIXED.equals(type)) {
      int fixedId = Settings.getRequiredInt(config, FIXED_ID_KEY, "fixed instance id");
      if (fixedId < InstanceIds.MIN_ID || fixedId > InstanceIds.MAX_ID) {
        throw new RosterConfigException("Fixed instance id " + fixedId + " in configuration properties key \"" + FIXED_ID_KEY + "\" is outside ["
            + InstanceIds.MIN_ID + ", " + InstanceIds.MAX_ID + "].");
      }
      return new FixedApplicationInstanceIdSource(fixedId, notifier, failureHandler);
    }

    ObjectStoreRepo repo = createRepo(type, config);
    InstanceMetadata metadata = InstanceMetadata.forLocalHost(Settings.get(config, APPLICATION_NAME_KEY, InstanceMetadata.UNKNOWN));
    return new ObjectStoreApplicationInstanceIdSource(repo, metadata, notifier, failureHandler);
  }

  static ObjectStoreRepo createRepo(String type, Properties config) throws RosterException {
    if (STORE_TYPE_MEMORY.equals(type)) {
      return new InMemoryObjectStoreRepo();
    }
    if (!STORE_TYPE_CURATOR.equals(type) && !STORE_TYPE_ZOOKEEPER.equals(type)) {
      throw new RosterConfigException("Unknown instance id store type \"" + type + "\" in configuration properties key \"" + STORE_TYPE_KEY
          + "\".  Expected one of " + STORE_TYPE_CURATOR + ", " + STORE_TYPE_ZOOKEEPER + ", " + STORE_TYPE_MEMORY + ", " + STORE_TYPE_FIXED + ".");
    }

    String connect = Settings.getRequired(config, ZK_CONNECT_KEY, "ZooKeeper connection string");
    String path = Settings.getRequired(config, ZK_PATH_KEY, "ZooKeeper namespace path");
    if (!path.startsWith("/") || path.length() < 2 || path.endsWith("/")) {
      throw new RosterConfigException("ZooKeeper namespace path \"" + path + "\" in configuration properties key \"" + ZK_PATH_KEY
          + "\" must be absolute, below the root and without a trailing slash.");
    }
    int sessionTimeout = Settings.getInt(config, ZK_SESSION_TIMEOUT_KEY, DEFAULT_SESSION_TIMEOUT_MS);

    if (STORE_TYPE_CURATOR.equals(type)) {
      int baseSleep = Settings.getInt(config, CURATOR_BASE_SLEEP_KEY, DEFAULT_BASE_SLEEP_MS);
      int maxRetries = Settings.getInt(config, CURATOR_MAX_RETRIES_KEY, DEFAULT_MAX_RETRIES);
      CuratorFramework client = CuratorFrameworkFactory.instance(connect, sessionTimeout, baseSleep, maxRetries);
      return new CuratorObjectStoreRepo(client, path, true);
    }

    try {
      ZooKeeperClient zk = new ZooKeeperClient(connect, sessionTimeout, new Watcher() {
        @Override
        public void process(WatchedEvent event) {

        }
      });
      return new ZooKeeperObjectStoreRepo(zk, path, true);
    } catch (IOException e) {
      throw new RosterException("Could not connect to ZooKeeper at \"" + connect + "\".", e);
    }
  }
}
