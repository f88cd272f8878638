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
import org.apache.nnproxy.rpc.RpcAuth;
import org.apache.nnproxy.rpc.SessionConfig;
import org.apache.nnproxy.server.Namenode;
import org.apache.nnproxy.server.NamenodeFactory;
import org.apache.nnproxy.server.NamenodeInfo;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Random;

/**
 * A {@link Namenode} over all the NameNodes of an HA nameservice.
 * <p>
 * Every call goes to the NameNode currently believed active. If it turns out to be standby or
 * unreachable, the call is retried on the next NameNode, up to the configured max ha retry.
 * Arguments, results and errors of the operations are those of a single NameNode.
 */
public class NamenodeProxy implements Namenode {
    private static final Logger LOG = LogManager.getLogger(NamenodeProxy.class);

    private final String clusterId;
    private final HaConfig haConfig;
    private final ActiveNamenodePointer activeNamenode;
    private final FailoverRetryExecutor executor;

    public NamenodeProxy(List<NamenodeInfo> namenodeInfos, String tokenService, SessionConfig conf,
                         RpcAuth auth, NamenodeFactory factory) throws IOException {
        this(namenodeInfos, tokenService, conf, auth, factory, new Random(System.currentTimeMillis()));
    }

    public NamenodeProxy(List<NamenodeInfo> namenodeInfos, String tokenService, SessionConfig conf,
                         RpcAuth auth, NamenodeFactory factory, Random random) throws IOException {
        this.clusterId = tokenService;
        NamenodeEndpointSet namenodes = new NamenodeEndpointSet(namenodeInfos, tokenService, conf, auth,
                factory, random);
        this.haConfig = namenodes.getHaConfig();
        this.activeNamenode = new ActiveNamenodePointer(namenodes);
        this.executor = new FailoverRetryExecutor(activeNamenode, haConfig);
        LOG.info("create namenode proxy for {} with namenodes {}, {}", clusterId, namenodeInfos, haConfig);
    }

    public String getClusterId() {
        return clusterId;
    }

    public HaConfig getHaConfig() {
        return haConfig;
    }

    @VisibleForTesting
    ActiveNamenodePointer getActiveNamenode() {
        return activeNamenode;
    }

    @Override
    public LocatedBlocks getBlockLocations(String src, long offset, long length) throws IOException {
        return executor.execute("getBlockLocations", nn -> nn.getBlockLocations(src, offset, length));
    }

    @Override
    public FileStatus create(String src, Permission masked, String clientName, int flag, boolean createParent,
                             short replication, long blockSize) throws IOException {
        return executor.execute("create",
                nn -> nn.create(src, masked, clientName, flag, createParent, replication, blockSize));
    }

    @Override
    public Pair<LocatedBlock, FileStatus> append(String src, String clientName, int flag) throws IOException {
        return executor.execute("append", nn -> nn.append(src, clientName, flag));
    }

    @Override
    public boolean setReplication(String src, short replication) throws IOException {
        return executor.execute("setReplication", nn -> nn.setReplication(src, replication));
    }

    @Override
    public void setPermission(String src, Permission permission) throws IOException {
        executor.run("setPermission", nn -> nn.setPermission(src, permission));
    }

    @Override
    public void setOwner(String src, String username, String groupname) throws IOException {
        executor.run("setOwner", nn -> nn.setOwner(src, username, groupname));
    }

    @Override
    public void abandonBlock(ExtendedBlock b, String src, String holder, long fileId) throws IOException {
        executor.run("abandonBlock", nn -> nn.abandonBlock(b, src, holder, fileId));
    }

    @Override
    public LocatedBlock addBlock(String src, String clientName, ExtendedBlock previous,
                                 List<DatanodeInfo> excludeNodes, long fileId) throws IOException {
        return executor.execute("addBlock", nn -> nn.addBlock(src, clientName, previous, excludeNodes, fileId));
    }

    @Override
    public LocatedBlock getAdditionalDatanode(String src, ExtendedBlock blk, List<DatanodeInfo> existings,
                                              List<String> storageIDs, List<DatanodeInfo> excludes,
                                              int numAdditionalNodes, String clientName) throws IOException {
        return executor.execute("getAdditionalDatanode", nn -> nn.getAdditionalDatanode(src, blk, existings,
                storageIDs, excludes, numAdditionalNodes, clientName));
    }

    @Override
    public boolean complete(String src, String clientName, ExtendedBlock last, long fileId) throws IOException {
        return executor.execute("complete", nn -> nn.complete(src, clientName, last, fileId));
    }

    @Override
    public void reportBadBlocks(List<LocatedBlock> blocks) throws IOException {
        executor.run("reportBadBlocks", nn -> nn.reportBadBlocks(blocks));
    }

    @Override
    public boolean rename(String src, String dst) throws IOException {
        return executor.execute("rename", nn -> nn.rename(src, dst));
    }

    @Override
    public void concat(String trg, List<String> srcs) throws IOException {
        executor.run("concat", nn -> nn.concat(trg, srcs));
    }

    @Override
    public boolean truncate(String src, long size, String clientName) throws IOException {
        return executor.execute("truncate", nn -> nn.truncate(src, size, clientName));
    }

    @Override
    public void getLease(String src, String clientName) throws IOException {
        executor.run("getLease", nn -> nn.getLease(src, clientName));
    }

    @Override
    public void releaseLease(String src, String clientName) throws IOException {
        executor.run("releaseLease", nn -> nn.releaseLease(src, clientName));
    }

    @Override
    public boolean deleteFile(String src, boolean recursive) throws IOException {
        return executor.execute("deleteFile", nn -> nn.deleteFile(src, recursive));
    }

    @Override
    public boolean mkdirs(String src, Permission masked, boolean createParent) throws IOException {
        return executor.execute("mkdirs", nn -> nn.mkdirs(src, masked, createParent));
    }

    @Override
    public DirectoryListing getListing(String src, String startAfter, boolean needLocation) throws IOException {
        return executor.execute("getListing", nn -> nn.getListing(src, startAfter, needLocation));
    }

    @Override
    public void renewLease(String clientName) throws IOException {
        executor.run("renewLease", nn -> nn.renewLease(clientName));
    }

    @Override
    public boolean recoverLease(String src, String clientName) throws IOException {
        return executor.execute("recoverLease", nn -> nn.recoverLease(src, clientName));
    }

    @Override
    public long[] getFsStats() throws IOException {
        return executor.execute("getFsStats", Namenode::getFsStats);
    }

    @Override
    public FileStatus getFileInfo(String src) throws IOException {
        return executor.execute("getFileInfo", nn -> nn.getFileInfo(src));
    }

    @Override
    public FileStatus getFileLinkInfo(String src) throws IOException {
        return executor.execute("getFileLinkInfo", nn -> nn.getFileLinkInfo(src));
    }

    @Override
    public ContentSummary getContentSummary(String path) throws IOException {
        return executor.execute("getContentSummary", nn -> nn.getContentSummary(path));
    }

    @Override
    public void setQuota(String path, long namespaceQuota, long diskspaceQuota) throws IOException {
        executor.run("setQuota", nn -> nn.setQuota(path, namespaceQuota, diskspaceQuota));
    }

    @Override
    public void fsync(String src, String client) throws IOException {
        executor.run("fsync", nn -> nn.fsync(src, client));
    }

    @Override
    public void setTimes(String src, long mtime, long atime) throws IOException {
        executor.run("setTimes", nn -> nn.setTimes(src, mtime, atime));
    }

    @Override
    public void createSymlink(String target, String link, Permission dirPerm, boolean createParent)
            throws IOException {
        executor.run("createSymlink", nn -> nn.createSymlink(target, link, dirPerm, createParent));
    }

    @Override
    public String getLinkTarget(String path) throws IOException {
        return executor.execute("getLinkTarget", nn -> nn.getLinkTarget(path));
    }

    @Override
    public LocatedBlock updateBlockForPipeline(ExtendedBlock block, String clientName) throws IOException {
        return executor.execute("updateBlockForPipeline", nn -> nn.updateBlockForPipeline(block, clientName));
    }

    @Override
    public void updatePipeline(String clientName, ExtendedBlock oldBlock, ExtendedBlock newBlock,
                               List<DatanodeInfo> newNodes, List<String> storageIDs) throws IOException {
        executor.run("updatePipeline",
                nn -> nn.updatePipeline(clientName, oldBlock, newBlock, newNodes, storageIDs));
    }

    @Override
    public Token getDelegationToken(String renewer) throws IOException {
        return executor.execute("getDelegationToken", nn -> nn.getDelegationToken(renewer));
    }

    @Override
    public long renewDelegationToken(Token token) throws IOException {
        return executor.execute("renewDelegationToken", nn -> nn.renewDelegationToken(token));
    }

    @Override
    public void cancelDelegationToken(Token token) throws IOException {
        executor.run("cancelDelegationToken", nn -> nn.cancelDelegationToken(token));
    }

    /**
     * Close every NameNode channel. Any call made afterwards fails with
     * {@link org.apache.nnproxy.common.FileSystemClosedException}.
     */
    @Override
    public void close() throws IOException {
        activeNamenode.close();
    }
}
