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

public class LocatedBlocks {
    private long fileLength;
    private boolean underConstruction;
    private boolean lastBlockComplete;
    private LocatedBlock lastBlock;
    private List<LocatedBlock> blocks = Lists.newArrayList();

    public long getFileLength() {
        return fileLength;
    }

    public void setFileLength(long fileLength) {
        this.fileLength = fileLength;
    }

    public boolean isUnderConstruction() {
        return underConstruction;
    }

    public void setUnderConstruction(boolean underConstruction) {
        this.underConstruction = underConstruction;
    }

    public boolean isLastBlockComplete() {
        return lastBlockComplete;
    }

    public void setLastBlockComplete(boolean lastBlockComplete) {
        this.lastBlockComplete = lastBlockComplete;
    }

    public LocatedBlock getLastBlock() {
        return lastBlock;
    }

    public void setLastBlock(LocatedBlock lastBlock) {
        this.lastBlock = lastBlock;
    }

    public List<LocatedBlock> getBlocks() {
        return blocks;
    }

    public void setBlocks(List<LocatedBlock> blocks) {
        this.blocks = blocks;
    }

    // the block containing the given file offset, or null if the offset is not covered
    public LocatedBlock findBlock(long position) {
        for (LocatedBlock block : blocks) {
            if (position >= block.getOffset() && position < block.getOffset() + block.getNumBytes()) {
                return block;
            }
        }
        return null;
    }
}
