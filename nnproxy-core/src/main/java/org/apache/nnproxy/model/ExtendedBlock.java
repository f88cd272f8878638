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

import java.util.Objects;

/**
 * A block identified across block pools.
 */
public class ExtendedBlock {
    private String poolId;
    private long blockId;
    private long numBytes;
    private long generationStamp;

    public ExtendedBlock() {
        this("", 0, 0, 0);
    }

    public ExtendedBlock(String poolId, long blockId, long numBytes, long generationStamp) {
        this.poolId = poolId;
        this.blockId = blockId;
        this.numBytes = numBytes;
        this.generationStamp = generationStamp;
    }

    public String getPoolId() {
        return poolId;
    }

    public void setPoolId(String poolId) {
        this.poolId = poolId;
    }

    public long getBlockId() {
        return blockId;
    }

    public void setBlockId(long blockId) {
        this.blockId = blockId;
    }

    public long getNumBytes() {
        return numBytes;
    }

    public void setNumBytes(long numBytes) {
        this.numBytes = numBytes;
    }

    public long getGenerationStamp() {
        return generationStamp;
    }

    public void setGenerationStamp(long generationStamp) {
        this.generationStamp = generationStamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExtendedBlock other = (ExtendedBlock) o;
        return blockId == other.blockId && generationStamp == other.generationStamp
                && numBytes == other.numBytes && Objects.equals(poolId, other.poolId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(poolId, blockId, numBytes, generationStamp);
    }

    @Override
    public String toString() {
        return poolId + ":blk_" + blockId + "_" + generationStamp;
    }
}
