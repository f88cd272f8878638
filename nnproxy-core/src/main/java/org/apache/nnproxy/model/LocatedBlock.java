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

package org.apache.nnproxy.model;

import com.google.common.collect.Lists;

import java.util.List;

/**
 * A block together with the datanodes holding its replicas and the token to access it.
 */
public class LocatedBlock extends ExtendedBlock {
    private long offset;
    private boolean corrupt;
    private List<DatanodeInfo> locations = Lists.newArrayList();
    private List<String> storageIDs = Lists.newArrayList();
    private Token token = new Token();

    public LocatedBlock() {
    }

    public LocatedBlock(ExtendedBlock block, long offset) {
        super(block.getPoolId(), block.getBlockId(), block.getNumBytes(), block.getGenerationStamp());
        this.offset = offset;
    }

    public long getOffset() {
        return offset;
    }

    public void setOffset(long offset) {
        this.offset = offset;
    }

    public boolean isCorrupt() {
        return corrupt;
    }

    public void setCorrupt(boolean corrupt) {
        this.corrupt = corrupt;
    }

    public List<DatanodeInfo> getLocations() {
        return locations;
    }

    public void setLocations(List<DatanodeInfo> locations) {
        this.locations = locations;
    }

    public List<String> getStorageIDs() {
        return storageIDs;
    }

    public void setStorageIDs(List<String> storageIDs) {
        this.storageIDs = storageIDs;
    }

    public Token getToken() {
        return token;
    }

    public void setToken(Token token) {
        this.token = token;
    }
}
