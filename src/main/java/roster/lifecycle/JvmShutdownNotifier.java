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
package roster.lifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers the shutdown signal through a JVM shutdown hook, one hook thread
 * per registration.
 */
public class JvmShutdownNotifier implements ShutdownNotifier {
  private static final Logger LOG = LoggerFactory.getLogger(JvmShutdownNotifier.class);
  private static final String HOOK_THREAD_NAME = "roster-shutdown";

  private final Runtime runtime;

  public JvmShutdownNotifier() {
    this(Runtime.getRuntime());
  }

  JvmShutdownNotifier(Runtime runtime) {
    this.runtime = runtime;
  }

  @Override
  public ShutdownRegistration register(Runnable callback) {
    final Thread hook = new Thread(callback, HOOK_THREAD_NAME);
    this.runtime.addShutdownHook(hook);
    LOG.debug("Registered shutdown hook {}", hook);
    return new ShutdownRegistration() {
      private final AtomicBoolean unregistered = new AtomicBoolean(false);

      @Override
      public void unregister() {
        if (!this.unregistered.compareAndSet(false, true)) {
          return;
        }
        try {
          runtime.removeShutdownHook(hook);
          LOG.debug("Removed shutdown hook {}", hook);
        } catch (IllegalStateException e) {
          // the JVM is already running its hooks, this one included
          LOG.debug("Shutdown in progress, hook {} stays registered", hook);
        }
      }
    };
  }

}
