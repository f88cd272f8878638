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

package org.apache.nnproxy.common;

public class Config extends ConfigBase {

    /**
     * The max number of times a call is retried against another NameNode after the current one
     * reported it is standby or became unreachable. Only used when more than one NameNode is configured.
     * A call makes at most rpc_max_ha_retry + 1 attempts before it fails.
     */
    @ConfField(mutable = true)
    public static int rpc_max_ha_retry = 15;

    /**
     * Timeouts of the rpc channel to one NameNode, in milliseconds.
     * These are handed to the NameNode channel untouched.
     */
    @ConfField public static int rpc_connect_timeout_ms = 600 * 1000;
    @ConfField public static int rpc_read_timeout_ms = 3600 * 1000;
    @ConfField public static int rpc_write_timeout_ms = 3600 * 1000;

    /**
     * An idle rpc connection is closed after rpc_max_idle_ms.
     * A ping is sent on a connection with outstanding calls every rpc_ping_timeout_ms.
     */
    @ConfField public static int rpc_max_idle_ms = 10 * 1000;
    @ConfField public static int rpc_ping_timeout_ms = 10 * 1000;

    // times to retry connecting to the same NameNode before the channel gives up
    @ConfField public static int rpc_max_retry_on_connect = 10;

    @ConfField public static boolean rpc_tcp_no_delay = true;

    // SO_LINGER of the rpc socket in seconds, -1 means disabled
    @ConfField public static int rpc_socket_linger_timeout_s = -1;

    // max length of one rpc response, in bytes
    @ConfField public static int rpc_max_length = 64 * 1024 * 1024;
}
