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

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.retry.ExponentialBackoffRetry;

/**
 * Basic factory for creating CuratorFramework instances used to reach the ZK
 * quorum that holds the instance id namespace.
 */
public class CuratorFrameworkFactory {

  /**
   * Generates a CuratorFramework instance for the specific ZK quorum, using the
   * ExponentialBackoffRetry strategy with specified base sleep time and number
   * of retries. Starts the instance before returning it. If this is intended to
   * be a singleton, the caller should guard it appropriately.
   * 
   * @param zkQuorum
   *          the ZK quorum string (including chroot if desired)
   * @param sessionTimeoutMs
   *          ZK session timeout
   * @param baseSleepTimeMs
   *          base sleep time for the exponential backoff retry policy for ZK
   *          interaction
   * @param maxRetries
   *          maximum number of times to retry operations
   * @return a started CuratorFramework instance
   */
  public static CuratorFramework instance(String zkQuorum, int sessionTimeoutMs, int baseSleepTimeMs, int maxRetries) {
    ExponentialBackoffRetry retryPolicy = new ExponentialBackoffRetry(baseSleepTimeMs, maxRetries);
    CuratorFramework curatorClient = org.apache.curator.framework.CuratorFrameworkFactory.builder().connectString(zkQuorum)
        .sessionTimeoutMs(sessionTimeoutMs).retryPolicy(retryPolicy).build();
    curatorClient.start();

    return curatorClient;
  }

}
