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

import org.apache.nnproxy.common.Pair;
import org.apache.nnproxy.model.ContentSummary;
import org.apache.nnproxy.model.DatanodeInfo;
import org.apache.nnproxy.model.DirectoryListing;
import org.apache.nnproxy.model.ExtendedBlock;
import org.apache.nnproxy.model.FileStatus;
import org.apache.nnproxy.model.LocatedBlock;
import org.apache.nnproxy.model.LocatedBlocks;
import org.apache.nnproxy.model.Permission;
import org.apache.nnproxy.model.Token;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * The client protocol of one NameNode.
 * <p>
 * Besides the errors of each operation, any call may throw
 * {@link org.apache.nnproxy.common.StandbyException} if the NameNode is not the active one, or
 * {@link org.apache.nnproxy.common.FailoverException} if the channel to it broke.
 */
public interface Namenode extends Closeable {

    /**
     * Get the locations of the blocks of a file in the range [offset, offset + length).
     *
     * @throws java.io.FileNotFoundException if src does not exist
     */
    LocatedBlocks getBlockLocations(String src, long offset, long length) throws IOException;

    /**
     * Create a new file entry in the namespace. The file is visible but empty, and the client holds
     * the lease on it until {@link #complete} is called.
     *
     * @param flag combination of {@link org.apache.nnproxy.model.CreateFlag} values
     * @return the status of the created file
     */
    FileStatus create(String src, Permission masked, String clientName, int flag, boolean createParent,
                      short replication, long blockSize) throws IOException;

    /**
     * Append to the end of the file.
     *
     * @return the last partial block, null if the last block is full, and the status of the file
     */
    Pair<LocatedBlock, FileStatus> append(String src, String clientName, int flag) throws IOException;

    boolean setReplication(String src, short replication) throws IOException;

    void setPermission(String src, Permission permission) throws IOException;

    void setOwner(String src, String username, String groupname) throws IOException;

    // give up on a block allocated by addBlock
    void abandonBlock(ExtendedBlock b, String src, String holder, long fileId) throws IOException;

    /**
     * Allocate the next block of a file being written.
     *
     * @param previous the previous block, null for the first block
     * @param excludeNodes datanodes that must not be chosen for the new block
     */
    LocatedBlock addBlock(String src, String clientName, ExtendedBlock previous,
                          List<DatanodeInfo> excludeNodes, long fileId) throws IOException;

    // pick extra datanodes for a write pipeline that lost some of its members
    LocatedBlock getAdditionalDatanode(String src, ExtendedBlock blk, List<DatanodeInfo> existings,
                                       List<String> storageIDs, List<DatanodeInfo> excludes,
                                       int numAdditionalNodes, String clientName) throws IOException;

    /**
     * Close the file being written.
     *
     * @return true if the file is closed, false if the last block is not yet minimally replicated
     */
    boolean complete(String src, String clientName, ExtendedBlock last, long fileId) throws IOException;

    void reportBadBlocks(List<LocatedBlock> blocks) throws IOException;

    boolean rename(String src, String dst) throws IOException;

    // move the blocks of srcs to the end of trg, srcs are removed
    void concat(String trg, List<String> srcs) throws IOException;

    /**
     * Truncate the file to the given size.
     *
     * @return true if the truncation is done, false if the last block needs recovery first
     */
    boolean truncate(String src, long size, String clientName) throws IOException;

    void getLease(String src, String clientName) throws IOException;

    void releaseLease(String src, String clientName) throws IOException;

    boolean deleteFile(String src, boolean recursive) throws IOException;

    boolean mkdirs(String src, Permission masked, boolean createParent) throws IOException;

    /**
     * List one batch of the entries of a directory.
     *
     * @param startAfter the name to start after, empty for the first batch
     */
    DirectoryListing getListing(String src, String startAfter, boolean needLocation) throws IOException;

    // tell the NameNode the client is still alive, renewing all the leases it holds
    void renewLease(String clientName) throws IOException;

    // start lease recovery of a file, true if the file is already closed
    boolean recoverLease(String src, String clientName) throws IOException;

    /**
     * Get filesystem statistics: capacity, used, remaining, under replicated blocks, corrupt blocks,
     * missing blocks, in this order.
     */
    long[] getFsStats() throws IOException;

    FileStatus getFileInfo(String src) throws IOException;

    // like getFileInfo, but does not follow a symlink at src
    FileStatus getFileLinkInfo(String src) throws IOException;

    ContentSummary getContentSummary(String path) throws IOException;

    void setQuota(String path, long namespaceQuota, long diskspaceQuota) throws IOException;

    void fsync(String src, String client) throws IOException;

    void setTimes(String src, long mtime, long atime) throws IOException;

    void createSymlink(String target, String link, Permission dirPerm, boolean createParent) throws IOException;

    String getLinkTarget(String path) throws IOException;

    // get a new generation stamp and access token for a block whose pipeline is being rebuilt
    LocatedBlock updateBlockForPipeline(ExtendedBlock block, String clientName) throws IOException;

    void updatePipeline(String clientName, ExtendedBlock oldBlock, ExtendedBlock newBlock,
                        List<DatanodeInfo> newNodes, List<String> storageIDs) throws IOException;

    Token getDelegationToken(String renewer) throws IOException;

    // return the new expiration time
    long renewDelegationToken(Token token) throws IOException;

    void cancelDelegationToken(Token token) throws IOException;
}
