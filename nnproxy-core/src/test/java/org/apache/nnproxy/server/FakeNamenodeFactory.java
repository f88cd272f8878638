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

package org.apache.nnproxy.server;

import org.apache.nnproxy.rpc.RpcAuth;
import org.apache.nnproxy.rpc.SessionConfig;

import com.google.common.collect.Lists;

import java.io.IOException;
import java.util.List;

/**
 * Creates {@link FakeNamenode}s named "host:port" and remembers what it was given.
 */
public class FakeNamenodeFactory implements NamenodeFactory {
    private final List<FakeNamenode> created = Lists.newArrayList();
    private final List<String> tokenServices = Lists.newArrayList();
    private final List<SessionConfig> confs = Lists.newArrayList();
    private final List<RpcAuth> auths = Lists.newArrayList();
    private String unreachableHost;

    public FakeNamenodeFactory unreachable(String host) {
        this.unreachableHost = host;
        return this;
    }

    @Override
    public Namenode create(String host, int port, String tokenService, SessionConfig conf, RpcAuth auth)
            throws IOException {
        if (host.equals(unreachableHost)) {
            throw new IOException("cannot connect to " + host + ":" + port);
        }
        FakeNamenode namenode = new FakeNamenode(host + ":" + port);
        created.add(namenode);
        tokenServices.add(tokenService);
        confs.add(conf);
        auths.add(auth);
        return namenode;
    }

    public List<FakeNamenode> getCreated() {
        return created;
    }

    public FakeNamenode get(String name) {
        for (FakeNamenode namenode : created) {
            if (namenode.getName().equals(name)) {
                return namenode;
            }
        }
        throw new IllegalArgumentException("no namenode " + name);
    }

    public List<String> getTokenServices() {
        return tokenServices;
    }

    public List<SessionConfig> getConfs() {
        return confs;
    }

    public List<RpcAuth> getAuths() {
        return auths;
    }
}
