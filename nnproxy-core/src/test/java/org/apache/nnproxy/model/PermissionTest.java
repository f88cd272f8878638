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

import org.junit.Assert;
import org.junit.Test;

public class PermissionTest {

    @Test
    public void testActions() {
        Permission permission = new Permission(0750);
        Assert.assertEquals(7, permission.getUserAction());
        Assert.assertEquals(5, permission.getGroupAction());
        Assert.assertEquals(0, permission.getOtherAction());
        Assert.assertFalse(permission.getStickyBit());
        Assert.assertEquals("rwxr-x---", permission.toString());
    }

    @Test
    public void testStickyBit() {
        Assert.assertEquals("rwxrwxrwt", new Permission(01777).toString());
        Assert.assertEquals("rwxrwxrwT", new Permission(01776).toString());
        Assert.assertTrue(new Permission(01777).getStickyBit());
    }

    @Test
    public void testFileTypeBitsDropped() {
        Permission permission = new Permission(0100644);
        Assert.assertEquals(0644, permission.toShort());
        Assert.assertEquals(new Permission((short) 0644), permission);
        Assert.assertEquals(new Permission(0644).hashCode(), permission.hashCode());
    }

    @Test
    public void testCreateFlag() {
        int flag = CreateFlag.combine(CreateFlag.CREATE, CreateFlag.SYNC_BLOCK);
        Assert.assertEquals(9, flag);
        Assert.assertTrue(CreateFlag.CREATE.isSet(flag));
        Assert.assertTrue(CreateFlag.SYNC_BLOCK.isSet(flag));
        Assert.assertFalse(CreateFlag.OVERWRITE.isSet(flag));
        Assert.assertFalse(CreateFlag.APPEND.isSet(flag));
    }
}
