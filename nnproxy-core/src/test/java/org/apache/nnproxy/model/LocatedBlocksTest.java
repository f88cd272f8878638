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
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

public class LocatedBlocksTest {

    @Test
    public void testFindBlock() {
        LocatedBlock first = new LocatedBlock(new ExtendedBlock("bp-1", 1L, 100L, 1001L), 0L);
        LocatedBlock second = new LocatedBlock(new ExtendedBlock("bp-1", 2L, 50L, 1001L), 100L);
        LocatedBlocks blocks = new LocatedBlocks();
        blocks.setFileLength(150L);
        blocks.setBlocks(Lists.newArrayList(first, second));

        Assert.assertSame(first, blocks.findBlock(0L));
        Assert.assertSame(first, blocks.findBlock(99L));
        Assert.assertSame(second, blocks.findBlock(100L));
        Assert.assertSame(second, blocks.findBlock(149L));
        Assert.assertNull(blocks.findBlock(150L));
    }

    @Test
    public void testDirectoryListing() {
        FileStatus a = new FileStatus();
        a.setPath("a");
        FileStatus b = new FileStatus();
        b.setPath("b");
        b.setSymlink("/target");

        DirectoryListing listing = new DirectoryListing(Lists.newArrayList(a, b), true);
        Assert.assertTrue(listing.hasMore());
        Assert.assertEquals("b", listing.getLastName());
        Assert.assertTrue(a.isFile());
        Assert.assertTrue(b.isSymlink());
        Assert.assertFalse(b.isFile());
        Assert.assertEquals("", new DirectoryListing(Lists.<FileStatus>newArrayList(), false).getLastName());
    }

    @Test
    public void testTokenUrlString() {
        Token token = new Token("abc".getBytes(StandardCharsets.UTF_8), new byte[0], "HDFS_DELEGATION_TOKEN",
                "ha-hdfs:cluster");
        Assert.assertEquals("YWJj..HDFS_DELEGATION_TOKEN.ha-hdfs:cluster", token.toUrlString());
        Token same = new Token("abc".getBytes(StandardCharsets.UTF_8), new byte[0], "HDFS_DELEGATION_TOKEN",
                "ha-hdfs:cluster");
        Assert.assertEquals(token, same);
        Assert.assertEquals(token.hashCode(), same.hashCode());
    }
}
