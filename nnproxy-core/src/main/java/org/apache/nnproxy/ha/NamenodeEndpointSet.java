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
import org.apache.nnproxy.rpc.RpcAuth;
import org.apache.nnproxy.rpc.SessionConfig;
import org.apache.nnproxy.server.Namenode;
import org.apache.nnproxy.server.NamenodeFactory;
import org.apache.nnproxy.server.NamenodeInfo;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * One rpc channel per configured NameNode, in an order shuffled once at creation so that clients
 * started together do not all try the same NameNode first.
 * <p>
 * Not thread safe, {@link ActiveNamenodePointer} guards it with its lock.
 */
public class NamenodeEndpointSet {
    private static final Logger LOG = LogManager.getLogger(NamenodeEndpointSet.class);

    private final List<Namenode> namenodes = Lists.newArrayList();
    private final HaConfig haConfig;

    public NamenodeEndpointSet(List<NamenodeInfo> namenodeInfos, String tokenService, SessionConfig conf,
                               RpcAuth auth, NamenodeFactory factory, Random random) throws IOException {
        if (namenodeInfos == null || namenodeInfos.isEmpty()) {
            throw new InvalidAddressException("Cannot create namenode proxy, no namenode is configured");
        }
        haConfig = HaConfig.of(namenodeInfos.size(), conf.getRpcMaxHaRetry());

        try {
            for (NamenodeInfo info : namenodeInfos) {
                String rpcAddr = Strings.nullToEmpty(info.getRpcAddr());
                List<String> nninfo = Splitter.on(':').splitToList(rpcAddr);
                if (nninfo.size() != 2) {
                    throw new InvalidAddressException(String.format(
                            "Cannot create namenode proxy, %s does not contain host or port", rpcAddr));
                }
                String host = nninfo.get(0).trim();
                int port = parsePort(rpcAddr, nninfo.get(1).trim());
                if (host.isEmpty()) {
                    throw new InvalidAddressException(String.format(
                            "Cannot create namenode proxy, %s does not contain host or port", rpcAddr));
                }
                namenodes.add(factory.create(host, port, tokenService, conf, auth));
            }
        } catch (IOException | RuntimeException e) {
            try {
                closeAll(drain());
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }

        Collections.shuffle(namenodes, random);
        LOG.debug("namenode order after shuffle: {}", namenodes);
    }

    private static int parsePort(String rpcAddr, String port) throws InvalidAddressException {
        try {
            int value = Integer.parseInt(port);
            if (value <= 0 || value > 65535) {
                throw new InvalidAddressException(String.format(
                        "Cannot create namenode proxy, port of %s is out of range", rpcAddr));
            }
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidAddressException(String.format(
                    "Cannot create namenode proxy, port of %s is not a number", rpcAddr));
        }
    }

    public HaConfig getHaConfig() {
        return haConfig;
    }

    public int size() {
        return namenodes.size();
    }

    public boolean isEmpty() {
        return namenodes.isEmpty();
    }

    // index is taken modulo the size of the set
    public Namenode get(int index) {
        return namenodes.get(Math.floorMod(index, namenodes.size()));
    }

    /**
     * Empty the set for good and return the NameNodes it held, so the caller can close them.
     */
    public List<Namenode> drain() {
        List<Namenode> drained = ImmutableList.copyOf(namenodes);
        namenodes.clear();
        return drained;
    }

    /**
     * Close every given NameNode. The first failure is thrown once all of them were tried.
     */
    public static void closeAll(List<Namenode> toClose) throws IOException {
        IOException first = null;
        for (Namenode namenode : toClose) {
            try {
                namenode.close();
            } catch (IOException e) {
                LOG.warn("failed to close namenode {}", namenode, e);
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
