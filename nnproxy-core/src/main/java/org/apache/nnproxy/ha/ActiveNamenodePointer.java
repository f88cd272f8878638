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

import org.apache.nnproxy.common.FileSystemClosedException;
import org.apache.nnproxy.common.Pair;
import org.apache.nnproxy.server.Namenode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Index of the NameNode believed to be active.
 * <p>
 * A caller reads the active NameNode together with the index it saw, and after a failure asks to move
 * past exactly that index. If another thread already moved on, the request is ignored, so many threads
 * failing on the same NameNode cause a single failover.
 * The lock is never held across a call to a NameNode.
 */
public class ActiveNamenodePointer {
    private static final Logger LOG = LogManager.getLogger(ActiveNamenodePointer.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final NamenodeEndpointSet namenodes;
    private int currentNamenode = 0;

    public ActiveNamenodePointer(NamenodeEndpointSet namenodes) {
        this.namenodes = namenodes;
    }

    /**
     * @return the active NameNode and the index it was read at
     * @throws FileSystemClosedException if the proxy is closed
     */
    public Pair<Namenode, Integer> getActive() throws FileSystemClosedException {
        lock.lock();
        try {
            if (namenodes.isEmpty()) {
                throw new FileSystemClosedException("NamenodeProxy is closed.");
            }
            return Pair.of(namenodes.get(currentNamenode), currentNamenode);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move to the next NameNode if the index is still the observed one.
     *
     * @return false if another thread already failed over past observedIndex, or the proxy is closed
     */
    public boolean advance(int observedIndex) {
        lock.lock();
        try {
            if (observedIndex != currentNamenode || namenodes.isEmpty()) {
                // already failover in another thread
                return false;
            }
            currentNamenode = (currentNamenode + 1) % namenodes.size();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int current() {
        lock.lock();
        try {
            return currentNamenode;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return namenodes.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Empty the NameNode set, then close the NameNodes outside the lock. Calling it again does nothing.
     */
    public void close() throws IOException {
        List<Namenode> toClose;
        lock.lock();
        try {
            toClose = namenodes.drain();
        } finally {
            lock.unlock();
        }
        if (toClose.isEmpty()) {
            return;
        }
        LOG.info("close namenodes {}", toClose);
        NamenodeEndpointSet.closeAll(toClose);
    }
}
