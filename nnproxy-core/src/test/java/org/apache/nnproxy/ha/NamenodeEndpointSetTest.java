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

import org.apache.nnproxy.common.InvalidAddressException;
import org.apache.nnproxy.rpc.AuthMethod;
import org.apache.nnproxy.rpc.RpcAuth;
import org.apache.nnproxy.rpc.SessionConfig;
import org.apache.nnproxy.rpc.UserInfo;
import org.apache.nnproxy.server.FakeNamenode;
import org.apache.nnproxy.server.FakeNamenodeFactory;
import org.apache.nnproxy.server.Namenode;
import org.apache.nnproxy.server.NamenodeInfo;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

public class NamenodeEndpointSetTest {
    private static final List<String> ADDRS = Lists.newArrayList("nn1:8020", "nn2:8020", "nn3:8020");

    private SessionConfig conf;
    private RpcAuth auth;
    private FakeNamenodeFactory factory;

    @Before
    public void setUp() {
        conf = new SessionConfig().setRpcMaxHaRetry(4);
        auth = new RpcAuth(new UserInfo("hdfs"), AuthMethod.SIMPLE);
        factory = new FakeNamenodeFactory();
    }

    private static List<NamenodeInfo> infos(List<String> addrs) {
        List<NamenodeInfo> infos = Lists.newArrayList();
        for (String addr : addrs) {
            infos.add(new NamenodeInfo(addr));
        }
        return infos;
    }

    private NamenodeEndpointSet create(List<String> addrs, Random random) throws IOException {
        return new NamenodeEndpointSet(infos(addrs), "ha-cluster", conf, auth, factory, random);
    }

    private static List<String> names(NamenodeEndpointSet set) {
        List<String> names = Lists.newArrayList();
        for (int i = 0; i < set.size(); i++) {
            names.add(((FakeNamenode) set.get(i)).getName());
        }
        return names;
    }

    private void assertInvalid(String addr) throws IOException {
        try {
            create(Lists.newArrayList("nn1:8020", addr), new NoShuffleRandom());
            Assert.fail("address " + addr + " should be rejected");
        } catch (InvalidAddressException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains(addr));
        }
    }

    @Test
    public void testHaEnabledWithSeveralNamenodes() throws IOException {
        NamenodeEndpointSet set = create(ADDRS, new NoShuffleRandom());
        Assert.assertEquals(3, set.size());
        Assert.assertFalse(set.isEmpty());
        Assert.assertTrue(set.getHaConfig().isEnabled());
        Assert.assertEquals(4, set.getHaConfig().getMaxRetry());
        Assert.assertEquals(ADDRS, names(set));
    }

    @Test
    public void testHaDisabledWithOneNamenode() throws IOException {
        NamenodeEndpointSet set = create(Lists.newArrayList("nn1:8020"), new Random(1));
        Assert.assertEquals(1, set.size());
        Assert.assertFalse(set.getHaConfig().isEnabled());
        Assert.assertEquals(0, set.getHaConfig().getMaxRetry());
    }

    @Test
    public void testNegativeRetryRejectedOnlyWithHa() throws IOException {
        conf.setRpcMaxHaRetry(-1);
        NamenodeEndpointSet single = create(Lists.newArrayList("nn1:8020"), new Random(1));
        Assert.assertEquals(0, single.getHaConfig().getMaxRetry());
        try {
            create(ADDRS, new Random(1));
            Assert.fail("negative max ha retry should be rejected");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("-1"));
        }
    }

    @Test
    public void testInvalidAddresses() throws IOException {
        assertInvalid("hostonly");
        assertInvalid("nn2:8020:1");
        assertInvalid(":8020");
        assertInvalid("nn2:rpc");
        assertInvalid("nn2:0");
        assertInvalid("nn2:65536");
        assertInvalid("");
    }

    @Test(expected = InvalidAddressException.class)
    public void testEmptyAddressList() throws IOException {
        create(Lists.<String>newArrayList(), new Random(1));
    }

    @Test
    public void testInvalidAddressClosesBuiltNamenodes() throws IOException {
        try {
            create(Lists.newArrayList("nn1:8020", "nn2:8020", "nn3"), new NoShuffleRandom());
            Assert.fail();
        } catch (InvalidAddressException e) {
            // expected
        }
        Assert.assertEquals(2, factory.getCreated().size());
        for (FakeNamenode namenode : factory.getCreated()) {
            Assert.assertTrue(namenode.isClosed());
        }
    }

    @Test
    public void testFactoryFailureClosesBuiltNamenodes() {
        factory.unreachable("nn3");
        try {
            create(ADDRS, new NoShuffleRandom());
            Assert.fail();
        } catch (IOException e) {
            Assert.assertEquals("cannot connect to nn3:8020", e.getMessage());
        }
        Assert.assertEquals(2, factory.getCreated().size());
        Assert.assertTrue(factory.get("nn1:8020").isClosed());
        Assert.assertTrue(factory.get("nn2:8020").isClosed());
    }

    @Test
    public void testPassesSettingsToFactory() throws IOException {
        create(Lists.newArrayList("nn1:8020", " nn2 : 9000 "), new NoShuffleRandom());
        Assert.assertEquals("nn2:9000", factory.getCreated().get(1).getName());
        for (int i = 0; i < 2; i++) {
            Assert.assertEquals("ha-cluster", factory.getTokenServices().get(i));
            Assert.assertSame(conf, factory.getConfs().get(i));
            Assert.assertSame(auth, factory.getAuths().get(i));
        }
    }

    @Test
    public void testShuffleIsDeterministicForSeed() throws IOException {
        List<String> expected = Lists.newArrayList(ADDRS);
        Collections.shuffle(expected, new Random(20240601L));

        Assert.assertEquals(expected, names(create(ADDRS, new Random(20240601L))));
        Assert.assertEquals(expected, names(create(ADDRS, new Random(20240601L))));
    }

    @Test
    public void testShuffleIsUniform() throws IOException {
        Random seeds = new Random(42);
        Map<String, Integer> firsts = Maps.newHashMap();
        int rounds = 3000;
        for (int i = 0; i < rounds; i++) {
            NamenodeEndpointSet set = create(ADDRS, new Random(seeds.nextLong()));
            firsts.merge(((FakeNamenode) set.get(0)).getName(), 1, Integer::sum);
        }
        Assert.assertEquals(3, firsts.size());
        for (Map.Entry<String, Integer> entry : firsts.entrySet()) {
            int count = entry.getValue();
            Assert.assertTrue(entry.getKey() + " came first " + count + " times", count > 850 && count < 1150);
        }
    }

    @Test
    public void testGetWrapsIndex() throws IOException {
        NamenodeEndpointSet set = create(ADDRS, new NoShuffleRandom());
        Assert.assertSame(set.get(0), set.get(3));
        Assert.assertSame(set.get(2), set.get(-1));
    }

    @Test
    public void testDrain() throws IOException {
        NamenodeEndpointSet set = create(ADDRS, new NoShuffleRandom());
        List<Namenode> drained = set.drain();
        Assert.assertEquals(3, drained.size());
        Assert.assertTrue(set.isEmpty());
        Assert.assertTrue(set.drain().isEmpty());
        for (FakeNamenode namenode : factory.getCreated()) {
            Assert.assertFalse(namenode.isClosed());
        }
    }

    @Test
    public void testCloseAllTriesEveryNamenode() {
        FakeNamenode nn1 = new FakeNamenode("nn1").failOnClose(new IOException("nn1 close"));
        FakeNamenode nn2 = new FakeNamenode("nn2");
        FakeNamenode nn3 = new FakeNamenode("nn3").failOnClose(new IOException("nn3 close"));
        try {
            NamenodeEndpointSet.closeAll(Lists.<Namenode>newArrayList(nn1, nn2, nn3));
            Assert.fail();
        } catch (IOException e) {
            Assert.assertEquals("nn1 close", e.getMessage());
            Assert.assertEquals(1, e.getSuppressed().length);
            Assert.assertEquals("nn3 close", e.getSuppressed()[0].getMessage());
        }
        Assert.assertTrue(nn1.isClosed());
        Assert.assertTrue(nn2.isClosed());
        Assert.assertTrue(nn3.isClosed());
    }
}
