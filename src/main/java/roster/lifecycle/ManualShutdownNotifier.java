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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A notifier driven by the host: callbacks run when {@link #shutdown()} is
 * called, in registration order. Registrations made after shutdown are never
 * run.
 */
public class ManualShutdownNotifier implements ShutdownNotifier {
  private static final Logger LOG = LoggerFactory.getLogger(ManualShutdownNotifier.class);

  private final Object lock = new Object();
  private final List<Entry> entries = new ArrayList<Entry>();
  private boolean shutdown = false;

  @Override
  public ShutdownRegistration register(Runnable callback) {
    final Entry entry = new Entry(callback);
    synchronized (this.lock) {
      if (!this.shutdown) {
        this.entries.add(entry);
      } else {
        LOG.debug("Shutdown already signaled, callback {} will not run", callback);
      }
    }
    return new ShutdownRegistration() {
      @Override
      public void unregister() {
        synchronized (lock) {
          entries.remove(entry);
        }
      }
    };
  }

  /**
   * Runs every registered callback once. Later calls do nothing.
   */
  public void shutdown() {
    List<Entry> toRun;
    synchronized (this.lock) {
      if (this.shutdown) {
        return;
      }
      this.shutdown = true;
      toRun = new ArrayList<Entry>(this.entries);
      this.entries.clear();
    }
    for (Entry entry : toRun) {
      try {
        entry.callback.run();
      } catch (RuntimeException e) {
        LOG.error("Shutdown callback " + entry.callback + " failed; continuing with the remaining callbacks.", e);
      }
    }
  }

  public boolean isShutdown() {
    synchronized (this.lock) {
      return this.shutdown;
    }
  }

  public int getRegistrationCount() {
    synchronized (this.lock) {
      return this.entries.size();
    }
  }

  private static final class Entry {
    private final Runnable callback;

    private Entry(Runnable callback) {
      this.callback = callback;
    }
  }
}
