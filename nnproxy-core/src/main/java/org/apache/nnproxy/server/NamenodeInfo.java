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

import com.google.common.base.Strings;

import java.util.Objects;

/**
 * Addresses of one NameNode of a nameservice.
 */
public class NamenodeInfo {
    private final String rpcAddr;
    private final String httpAddr;

    public NamenodeInfo(String rpcAddr) {
        this(rpcAddr, "");
    }

    public NamenodeInfo(String rpcAddr, String httpAddr) {
        this.rpcAddr = rpcAddr;
        this.httpAddr = Strings.nullToEmpty(httpAddr);
    }

    public String getRpcAddr() {
        return rpcAddr;
    }

    public String getHttpAddr() {
        return httpAddr;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NamenodeInfo)) {
            return false;
        }
        NamenodeInfo other = (NamenodeInfo) o;
        return Objects.equals(rpcAddr, other.rpcAddr) && Objects.equals(httpAddr, other.httpAddr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rpcAddr, httpAddr);
    }

    @Override
    public String toString() {
        return rpcAddr;
    }
}
