/*
 * CLeak: A Resource-Ownership Checker for C/C++
 *
 * Copyright (C) 2022 Tian Tan <tiantan@nju.edu.cn>
 * Copyright (C) 2022 Yue Li <yueli@nju.edu.cn>
 *
 * This file is part of CLeak.
 *
 * CLeak is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License
 * as published by the Free Software Foundation, either version 3
 * of the License, or (at your option) any later version.
 *
 * CLeak is distributed in the hope that it will be useful,but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY
 * or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General
 * Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public
 * License along with CLeak. If not, see <https://www.gnu.org/licenses/>.
 */

package pascal.cleak.library;

import org.junit.Test;
import pascal.cleak.config.ConfigException;
import pascal.cleak.ir.Function;
import pascal.cleak.ir.IRBuilder;
import pascal.cleak.ir.Var;
import pascal.cleak.ir.exp.CallExp;
import pascal.cleak.ir.type.ContainerType;
import pascal.cleak.ir.type.PrimitiveType;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class ConfigLibraryTest {

    private static final ConfigLibrary STD = ConfigLibrary.loadDefault();

    private final IRBuilder b = new IRBuilder();

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testMemoryFamily() {
        AllocFunc malloc = STD.getAllocator(b.call("malloc", b.lit(1))).orElseThrow();
        AllocFunc free = STD.getDeallocator(b.call("free", b.lit(0))).orElseThrow();
        assertEquals(malloc.family(), free.family());
        assertTrue(malloc.returnsResource());
        assertFalse(STD.isResource(malloc.family()));
        assertEquals(1, free.arg());
    }

    @Test
    public void testResourceFamilies() {
        AllocFunc fopen = STD.getAllocator(b.call("fopen")).orElseThrow();
        AllocFunc fclose = STD.getDeallocator("fclose").orElseThrow();
        AllocFunc open = STD.getAllocator(b.call("open")).orElseThrow();
        assertEquals(fopen.family(), fclose.family());
        assertTrue(STD.isResource(fopen.family()));
        assertNotEquals(fopen.family(), open.family());
        // fdopen releases a descriptor and returns a stream
        CallExp fdopen = b.call("fdopen");
        assertEquals(fopen.family(), STD.getAllocator(fdopen).orElseThrow().family());
        assertEquals(open.family(), STD.getDeallocator(fdopen).orElseThrow().family());
    }

    @Test
    public void testOutParameterAllocator() {
        AllocFunc func = STD.getAllocator(b.call("posix_memalign")).orElseThrow();
        assertFalse(func.returnsResource());
        assertEquals(1, func.arg());
    }

    @Test
    public void testReallocators() {
        assertEquals(1, STD.getReallocator(b.call("realloc")).orElseThrow().reallocArg());
        assertEquals(3, STD.getReallocator(b.call("freopen")).orElseThrow().reallocArg());
        assertTrue(STD.getAllocator(b.call("realloc")).isEmpty());
    }

    @Test
    public void testFunctionAttributes() {
        assertEquals(Optional.of(true), STD.isNoReturn(b.call("exit", b.lit(1))));
        assertEquals(Optional.of(false), STD.isNoReturn(b.call("malloc", b.lit(1))));
        assertEquals(Optional.of(false), STD.isNoReturn(b.call("printf")));
        assertEquals(Optional.empty(), STD.isNoReturn(b.call("frobnicate")));
        assertTrue(STD.isLeakIgnore("strlen"));
        assertFalse(STD.isLeakIgnore("free"));
        assertEquals(1, STD.getReturnedArg(b.call("strcpy")).getAsInt());
        assertTrue(STD.getReturnedArg(b.call("malloc")).isEmpty());
        assertTrue(STD.getArgDirection(b.call("memcpy"), 1).contains(Direction.OUT));
        assertTrue(STD.getArgDirection(b.call("memcpy"), 2).contains(Direction.IN));
        assertTrue(STD.getArgDirection(b.call("memcpy"), 3).isEmpty());
    }

    @Test
    public void testDefinedFunctionIsNoLibraryFunction() {
        Function malloc = b.function("malloc", PrimitiveType.VOID, b.block());
        CallExp call = b.call(malloc, b.lit(1));
        assertTrue(STD.getAllocator(call).isEmpty());
        assertTrue(STD.isNoReturn(call).isEmpty());
    }

    @Test
    public void testMemberFunctionName() {
        Var s = b.local("s", new ContainerType("std::string", true));
        Var n = b.local("n", PrimitiveType.INT);
        CallExp cStr = b.memberCall(b.var(s), false, "c_str");
        assertEquals("std::string::c_str", STD.getFunctionName(cStr));
        assertTrue(STD.isContainerBuiltin(cStr));
        assertEquals("", STD.getFunctionName(b.memberCall(b.var(n), false, "get")));
        assertEquals("free", STD.getFunctionName(b.call("free")));
    }

    @Test
    public void testSmartPointers() {
        assertTrue(STD.isSmartPointer(b.construct("std::shared_ptr", List.of())));
        assertFalse(STD.isSmartPointer(b.construct("std::vector", List.of())));
        assertFalse(STD.isSmartPointer(b.call("std::shared_ptr")));
    }

    @Test
    public void testReadLibrary() {
        ConfigLibrary library = ConfigLibrary.readLibrary(yaml(String.join("\n",
                "groups:",
                "  - kind: resource",
                "    alloc: [{name: acquire}, {name: acquire_into, arg: 2}]",
                "    dealloc: [{name: release_handle, arg: 2}]",
                "functions:",
                "  log_handle: {leak-ignore: true}",
                "  die: {noreturn: true}",
                "  fill: {args: {1: [out, in]}}",
                "smart-pointers: [my::handle]")), "test.yml");
        AllocFunc acquire = library.getAllocator(b.call("acquire")).orElseThrow();
        assertTrue(library.isResource(acquire.family()));
        assertEquals(2, library.getAllocator(b.call("acquire_into")).orElseThrow().arg());
        assertEquals(2, library.getDeallocator("release_handle").orElseThrow().arg());
        assertTrue(library.isLeakIgnore("log_handle"));
        assertEquals(Optional.of(true), library.isNoReturn(b.call("die")));
        assertEquals(2, library.getArgDirection(b.call("fill"), 1).size());
        assertTrue(library.isSmartPointer(b.construct("my::handle", List.of())));
    }

    @Test(expected = ConfigException.class)
    public void testUnknownKey() {
        ConfigLibrary.readLibrary(yaml("resources: []"), "bad.yml");
    }

    @Test(expected = ConfigException.class)
    public void testUnknownGroupKind() {
        ConfigLibrary.readLibrary(yaml("groups: [{kind: socket}]"), "bad.yml");
    }

    @Test(expected = ConfigException.class)
    public void testIllegalDirection() {
        ConfigLibrary.readLibrary(yaml("functions: {f: {args: {1: [sideways]}}}"), "bad.yml");
    }

    @Test(expected = ConfigException.class)
    public void testDuplicateAllocator() {
        ConfigLibrary.Builder builder = ConfigLibrary.builder();
        int family = builder.newGroup(false);
        builder.allocator("alloc", family).allocator("alloc", family);
    }
}
