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
import org.apache.nnproxy.model.Token;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

public class SessionConfigTest {
    private int maxHaRetry;

    @Before
    public void setUp() {
        maxHaRetry = Config.rpc_max_ha_retry;
    }

    @After
    public void tearDown() {
        Config.rpc_max_ha_retry = maxHaRetry;
    }

    @Test
    public void testSnapshotOfConfig() {
        Config.rpc_max_ha_retry = 7;
        SessionConfig conf = new SessionConfig();
        Config.rpc_max_ha_retry = 9;

        Assert.assertEquals(7, conf.getRpcMaxHaRetry());
        Assert.assertEquals(9, new SessionConfig().getRpcMaxHaRetry());
        Assert.assertEquals(Config.rpc_connect_timeout_ms, conf.getRpcConnectTimeoutMs());
        Assert.assertEquals(Config.rpc_tcp_no_delay, conf.isRpcTcpNoDelay());
    }

    @Test
    public void testOverrides() {
        SessionConfig conf = new SessionConfig().setRpcMaxHaRetry(2).setRpcReadTimeoutMs(1000);
        Assert.assertEquals(2, conf.getRpcMaxHaRetry());
        Assert.assertEquals(1000, conf.getRpcReadTimeoutMs());
        Assert.assertTrue(conf.toString().contains("rpcMaxHaRetry=2"));
        Assert.assertTrue(conf.toString().contains("rpcSocketLingerTimeoutS=" + Config.rpc_socket_linger_timeout_s));
        Assert.assertTrue(conf.toString().contains("rpcMaxLength=" + Config.rpc_max_length));
    }

    @Test
    public void testUserInfo() {
        UserInfo proxied = new UserInfo("alice", "hive/host@REALM");
        Assert.assertEquals("hive/host@REALM", proxied.getPrincipal());
        Assert.assertEquals("alice via hive/host@REALM", proxied.toString());

        UserInfo user = new UserInfo("alice");
        Assert.assertEquals("alice", user.getPrincipal());
        Token token = new Token("id".getBytes(StandardCharsets.UTF_8), new byte[0], "HDFS_DELEGATION_TOKEN",
                "ha-hdfs:cluster");
        user.addToken(token);
        Assert.assertSame(token, user.selectToken("ha-hdfs:cluster"));
        Assert.assertNull(user.selectToken("other"));
    }

    @Test(expected = NullPointerException.class)
    public void testAuthNeedsUser() {
        new RpcAuth(null, AuthMethod.SIMPLE);
    }
}
