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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One batch of a directory listing. The caller asks for the next batch with the name of the last entry
 * while {@link #hasMore()} is true.
 */
public class DirectoryListing {
    private final List<FileStatus> entries;
    private final boolean hasMore;

    public DirectoryListing(List<FileStatus> entries, boolean hasMore) {
        this.entries = ImmutableList.copyOf(entries);
        this.hasMore = hasMore;
    }

    public List<FileStatus> getEntries() {
        return entries;
    }

    public boolean hasMore() {
        return hasMore;
    }

    public String getLastName() {
        if (entries.isEmpty()) {
            return "";
        }
        return entries.get(entries.size() - 1).getPath();
    }
}
