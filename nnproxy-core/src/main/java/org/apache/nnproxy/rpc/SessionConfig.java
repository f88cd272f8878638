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

package org.apache.nnproxy.rpc;

import org.apache.nnproxy.common.Config;

import com.google.common.base.MoreObjects;

/**
 * Settings shared by the rpc channels of one client session. Values are taken from {@link Config}
 * when the session is created and may be overridden per session.
 */
public class SessionConfig {
    private int rpcMaxHaRetry;
    private int rpcConnectTimeoutMs;
    private int rpcReadTimeoutMs;
    private int rpcWriteTimeoutMs;
    private int rpcMaxIdleMs;
    private int rpcPingTimeoutMs;
    private int rpcMaxRetryOnConnect;
    private boolean rpcTcpNoDelay;
    private int rpcSocketLingerTimeoutS;
    private int rpcMaxLength;

    public SessionConfig() {
        this.rpcMaxHaRetry = Config.rpc_max_ha_retry;
        this.rpcConnectTimeoutMs = Config.rpc_connect_timeout_ms;
        this.rpcReadTimeoutMs = Config.rpc_read_timeout_ms;
        this.rpcWriteTimeoutMs = Config.rpc_write_timeout_ms;
        this.rpcMaxIdleMs = Config.rpc_max_idle_ms;
        this.rpcPingTimeoutMs = Config.rpc_ping_timeout_ms;
        this.rpcMaxRetryOnConnect = Config.rpc_max_retry_on_connect;
        this.rpcTcpNoDelay = Config.rpc_tcp_no_delay;
        this.rpcSocketLingerTimeoutS = Config.rpc_socket_linger_timeout_s;
        this.rpcMaxLength = Config.rpc_max_length;
    }

    public int getRpcMaxHaRetry() {
        return rpcMaxHaRetry;
    }

    public SessionConfig setRpcMaxHaRetry(int rpcMaxHaRetry) {
        this.rpcMaxHaRetry = rpcMaxHaRetry;
        return this;
    }

    public int getRpcConnectTimeoutMs() {
        return rpcConnectTimeoutMs;
    }

    public SessionConfig setRpcConnectTimeoutMs(int rpcConnectTimeoutMs) {
        this.rpcConnectTimeoutMs = rpcConnectTimeoutMs;
        return this;
    }

    public int getRpcReadTimeoutMs() {
        return rpcReadTimeoutMs;
    }

    public SessionConfig setRpcReadTimeoutMs(int rpcReadTimeoutMs) {
        this.rpcReadTimeoutMs = rpcReadTimeoutMs;
        return this;
    }

    public int getRpcWriteTimeoutMs() {
        return rpcWriteTimeoutMs;
    }

    public SessionConfig setRpcWriteTimeoutMs(int rpcWriteTimeoutMs) {
        this.rpcWriteTimeoutMs = rpcWriteTimeoutMs;
        return this;
    }

    public int getRpcMaxIdleMs() {
        return rpcMaxIdleMs;
    }

    public int getRpcPingTimeoutMs() {
        return rpcPingTimeoutMs;
    }

    public int getRpcMaxRetryOnConnect() {
        return rpcMaxRetryOnConnect;
    }

    public boolean isRpcTcpNoDelay() {
        return rpcTcpNoDelay;
    }

    public int getRpcSocketLingerTimeoutS() {
        return rpcSocketLingerTimeoutS;
    }

    public int getRpcMaxLength() {
        return rpcMaxLength;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("rpcMaxHaRetry", rpcMaxHaRetry)
                .add("rpcConnectTimeoutMs", rpcConnectTimeoutMs)
                .add("rpcReadTimeoutMs", rpcReadTimeoutMs)
                .add("rpcWriteTimeoutMs", rpcWriteTimeoutMs)
                .add("rpcMaxIdleMs", rpcMaxIdleMs)
                .add("rpcPingTimeoutMs", rpcPingTimeoutMs)
                .add("rpcMaxRetryOnConnect", rpcMaxRetryOnConnect)
                .add("rpcTcpNoDelay", rpcTcpNoDelay)
                .add("rpcSocketLingerTimeoutS", rpcSocketLingerTimeoutS)
                .add("rpcMaxLength", rpcMaxLength)
                .toString();
    }
}
