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

import java.io.Closeable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import roster.RosterException;
import roster.lifecycle.FailureHandler;
import roster.lifecycle.ShutdownNotifier;
import roster.lifecycle.ShutdownRegistration;

/**
 * Owns the application instance id of this process.
 * 
 * The id is obtained lazily on the first call to
 * {@link #getApplicationInstanceId()}, at most once, under a lock so that
 * concurrent callers wait for the first one and then see the same value. It is
 * released once, when the {@link ShutdownNotifier} signals shutdown or when the
 * source is closed, and is never obtained again afterwards.
 * 
 * Subclasses supply the actual acquisition and release.
 */
public abstract class ApplicationInstanceIdSource implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(ApplicationInstanceIdSource.class);

  private final Object lock = new Object();
  private final FailureHandler failureHandler;
  private final ShutdownRegistration shutdownRegistration;

  private volatile InstanceIdState state = InstanceIdState.UNACQUIRED;
  private int id = -1;
  private InstanceIdAllocationException failure = null;

  /**
   * @param shutdownNotifier
   *          signals when to release the id, may be null when the owner calls
   *          {@link #close()} itself
   * @param failureHandler
   *          receives release failures, may be null
   */
  protected ApplicationInstanceIdSource(ShutdownNotifier shutdownNotifier, FailureHandler failureHandler) {
    this.failureHandler = failureHandler;
    if (shutdownNotifier == null) {
      this.shutdownRegistration = null;
    } else {
      this.shutdownRegistration = shutdownNotifier.register(new Runnable() {
        @Override
        public void run() {
          seal("shutdown");
          release();
        }

        @Override
        public String toString() {
          return "release of " + ApplicationInstanceIdSource.this;
        }
      });
    }
  }

  /**
   * Obtains a context-unique id. Only ever called once per source, with the
   * source lock held.
   */
  protected abstract int acquireCore() throws InstanceIdAllocationException;

  /**
   * Gives the id back. Only ever called once, for an id returned by
   * {@link #acquireCore()}.
   */
  protected abstract void releaseCore(int id) throws Exception;

  /**
   * Returns the id of this process, obtaining it first if needed.
   * 
   * @throws InstanceIdAllocationException
   *           if the id could not be obtained, now or on an earlier call
   * @throws InstanceIdReleasedException
   *           if the id was already released
   */
  public int getApplicationInstanceId() throws RosterException {
    synchronized (this.lock) {
      switch (this.state) {
      case ACQUIRED:
        return this.id;
      case RELEASED:
        throw new InstanceIdReleasedException("The application instance id of " + this + " was already released.");
      case FAILED:
        throw this.failure;
      default:
        break;
      }

      this.state = InstanceIdState.ACQUIRING;
      LOG.info("Acquiring an application instance id for {}", this);
      try {
        int acquired = acquireCore();
        if (acquired < InstanceIds.MIN_ID || acquired > InstanceIds.MAX_ID) {
          throw new InstanceIdAllocationException(getClass().getSimpleName() + " produced instance id " + acquired + " outside [" + InstanceIds.MIN_ID
              + ", " + InstanceIds.MAX_ID + "].");
        }
        this.id = acquired;
        this.state = InstanceIdState.ACQUIRED;
        LOG.info("Acquired application instance id {} for {}", acquired, this);
        return acquired;
      } catch (InstanceIdAllocationException e) {
        fail(e);
        throw e;
      } catch (RuntimeException e) {
        InstanceIdAllocationException wrapped = new StoreBackendException("Unexpected failure while acquiring an application instance id.", e);
        fail(wrapped);
        throw wrapped;
      }
    }
  }

  private void fail(InstanceIdAllocationException e) {
    this.failure = e;
    this.state = InstanceIdState.FAILED;
    LOG.error("Failed to acquire an application instance id for " + this, e);
  }

  /**
   * Releases the id if this process holds one. Never throws: failures are
   * logged and handed to the failure handler. Does nothing if no id was
   * acquired.
   */
  public void release() {
    synchronized (this.lock) {
      if (this.state != InstanceIdState.ACQUIRED) {
        LOG.debug("No application instance id held by {} in state {}, nothing to release", this, this.state);
        return;
      }
      this.state = InstanceIdState.RELEASED;
      LOG.info("Releasing application instance id {} for {}", this.id, this);
      try {
        releaseCore(this.id);
      } catch (Exception e) {
        LOG.warn("Failed to release application instance id " + this.id + " for " + this + "; the id stays claimed until removed by hand.", e);
        handleFailure(e);
      }
    }
    unregister();
  }

  /**
   * Moves an untouched source straight to {@link InstanceIdState#RELEASED}, so
   * an id can no longer be acquired once nothing is left to release it.
   */
  private void seal(String reason) {
    synchronized (this.lock) {
      if (this.state == InstanceIdState.UNACQUIRED) {
        this.state = InstanceIdState.RELEASED;
        LOG.info("No application instance id acquired by {} before {}, no id will be acquired from now on", this, reason);
      }
    }
  }

  private void handleFailure(Exception e) {
    if (this.failureHandler == null) {
      return;
    }
    try {
      this.failureHandler.handle(e);
    } catch (RuntimeException handlerFailure) {
      LOG.warn("Failure handler " + this.failureHandler + " threw while handling a release failure.", handlerFailure);
    }
  }

  private void unregister() {
    if (this.shutdownRegistration != null) {
      this.shutdownRegistration.unregister();
    }
  }

  public InstanceIdState getState() {
    return this.state;
  }

  public boolean isAcquired() {
    return this.state == InstanceIdState.ACQUIRED;
  }

  /**
   * Releases the id, if held, and stops listening for shutdown. A source
   * closed before acquiring never acquires afterwards.
   */
  @Override
  public void close() {
    seal("close");
    release();
    unregister();
  }
}
