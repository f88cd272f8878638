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

public class ContentSummary {
    private final long length;
    private final long fileCount;
    private final long directoryCount;
    private final long quota;
    private final long spaceConsumed;
    private final long spaceQuota;

    public ContentSummary(long length, long fileCount, long directoryCount,
                          long quota, long spaceConsumed, long spaceQuota) {
        this.length = length;
        this.fileCount = fileCount;
        this.directoryCount = directoryCount;
        this.quota = quota;
        this.spaceConsumed = spaceConsumed;
        this.spaceQuota = spaceQuota;
    }

    public long getLength() {
        return length;
    }

    public long getFileCount() {
        return fileCount;
    }

    public long getDirectoryCount() {
        return directoryCount;
    }

    public long getQuota() {
        return quota;
    }

    public long getSpaceConsumed() {
        return spaceConsumed;
    }

    public long getSpaceQuota() {
        return spaceQuota;
    }

    @Override
    public String toString() {
        return "ContentSummary{length=" + length + ", files=" + fileCount + ", dirs=" + directoryCount
                + ", quota=" + quota + ", spaceConsumed=" + spaceConsumed + ", spaceQuota=" + spaceQuota + "}";
    }
}
