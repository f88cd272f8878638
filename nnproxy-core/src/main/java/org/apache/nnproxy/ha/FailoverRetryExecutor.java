// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.nnproxy.ha;

import org.apache.nnproxy.common.FailoverException;
import org.apache.nnproxy.common.Pair;
import org.apache.nnproxy.common.RpcException;
import org.apache.nnproxy.server.Namenode;

import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Runs a call on the active NameNode and fails over to the next one when the call is rejected by a
 * standby NameNode or the channel breaks.
 * <p>
 * A call is attempted at most {@code maxRetry + 1} times. When HA is disabled it is attempted once.
 * Once the attempts are used up the call fails with {@link RpcException}. Any other error of the call
 * is thrown as is, without retry and without moving the active index.
 */
public class FailoverRetryExecutor {
    private static final Logger LOG = LogManager.getLogger(FailoverRetryExecutor.class);

    private final ActiveNamenodePointer activeNamenode;
    private final HaConfig haConfig;

    public FailoverRetryExecutor(ActiveNamenodePointer activeNamenode, HaConfig haConfig) {
        this.activeNamenode = activeNamenode;
        this.haConfig = haConfig;
    }

    public <T> T execute(String op, NamenodeCall<T> call) throws IOException {
        int attempts = 0;
        while (true) {
            Pair<Namenode, Integer> active = activeNamenode.getActive();
            ++attempts;
            try {
                return call.call(active.first);
            } catch (IOException e) {
                FailureKind kind = FailureKind.of(e);
                if (!kind.isRetriable()) {
                    throw e;
                }
                if (!canRetry(attempts)) {
                    LOG.error("NamenodeProxy: Cannot failover to another NameNode for {}, attempts: {}.",
                            op, attempts);
                    throw terminalError(op, kind, e, attempts);
                }
                if (activeNamenode.advance(active.second)) {
                    LOG.warn("NamenodeProxy: Failover to another NameNode for {} after {}, retry count is {}.",
                            op, e.getMessage(), attempts);
                } else {
                    LOG.debug("NamenodeProxy: {} already failed over by another call, retry count is {}.",
                            op, attempts);
                }
            }
        }
    }

    public void run(String op, NamenodeAction action) throws IOException {
        execute(op, namenode -> {
            action.run(namenode);
            return null;
        });
    }

    private boolean canRetry(int attempts) {
        return haConfig.isEnabled() && attempts <= haConfig.getMaxRetry();
    }

    private RpcException terminalError(String op, FailureKind kind, IOException e, int attempts) {
        String msg = String.format("%s failed after %d attempt(s): %s", op, attempts, e.getMessage());
        if (kind == FailureKind.STANDBY) {
            return new RpcException(msg, attempts, e);
        }
        FailoverException failover = (FailoverException) e;
        // the channel always records why it gave up, a failover error without cause is a bug
        Preconditions.checkState(failover.hasNestedCause(),
                "failover error of %s carries no cause: %s", op, e.getMessage());
        return new RpcException(msg, attempts, failover.getCause());
    }
}
