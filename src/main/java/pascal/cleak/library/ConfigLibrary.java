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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import pascal.cleak.config.ConfigException;
import pascal.cleak.ir.exp.CallExp;
import pascal.cleak.ir.exp.Exp;
import pascal.cleak.ir.exp.VarExp;
import pascal.cleak.ir.type.ClassType;
import pascal.cleak.ir.type.ContainerType;
import pascal.cleak.ir.type.PointerType;
import pascal.cleak.ir.type.Type;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * {@link Library} whose metadata is declared in YAML, e.g.,
 * <pre>
 * groups:
 *   - kind: memory            # or: resource
 *     alloc:   [{name: malloc}, {name: posix_memalign, arg: 1}]
 *     dealloc: [{name: free}]
 *     realloc: [{name: realloc, realloc-arg: 1}]
 * functions:
 *   exit:   {noreturn: true}
 *   strcpy: {leak-ignore: true, return-arg: 1}
 *   fgets:  {args: {1: [out], 3: [in]}}
 * smart-pointers: [std::unique_ptr, std::shared_ptr]
 * </pre>
 * Each group gets its own family. A library can also be assembled
 * programmatically via {@link #builder()}.
 */
public class ConfigLibrary implements Library {

    private static final Logger logger = LogManager.getLogger(ConfigLibrary.class);

    /**
     * Class-path location of the library of the C and C++ standard libraries.
     */
    public static final String DEFAULT_LIBRARY = "library/std.yml";

    private final Map<String, AllocFunc> allocators;

    private final Map<String, AllocFunc> deallocators;

    private final Map<String, AllocFunc> reallocators;

    private final Set<Integer> resourceFamilies;

    private final Map<String, Boolean> noReturn;

    private final Set<String> leakIgnore;

    private final Set<String> use;

    private final Map<String, Integer> returnArgs;

    private final Map<String, Map<Integer, Set<Direction>>> directions;

    private final Set<String> containerBuiltins;

    private final Set<String> smartPointers;

    private ConfigLibrary(Builder builder) {
        allocators = Map.copyOf(builder.allocators);
        deallocators = Map.copyOf(builder.deallocators);
        reallocators = Map.copyOf(builder.reallocators);
        resourceFamilies = Set.copyOf(builder.resourceFamilies);
        noReturn = Map.copyOf(builder.noReturn);
        leakIgnore = Set.copyOf(builder.leakIgnore);
        use = Set.copyOf(builder.use);
        returnArgs = Map.copyOf(builder.returnArgs);
        Map<String, Map<Integer, Set<Direction>>> dirs = new HashMap<>();
        builder.directions.forEach((name, args) -> {
            Map<Integer, Set<Direction>> copy = new HashMap<>();
            args.forEach((argNr, dir) -> copy.put(argNr,
                    Collections.unmodifiableSet(EnumSet.copyOf(dir))));
            dirs.put(name, Map.copyOf(copy));
        });
        directions = Map.copyOf(dirs);
        containerBuiltins = Set.copyOf(builder.containerBuiltins);
        smartPointers = Set.copyOf(builder.smartPointers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the bundled library of the C and C++ standard libraries.
     */
    public static ConfigLibrary loadDefault() {
        InputStream in = ConfigLibrary.class.getClassLoader()
                .getResourceAsStream(DEFAULT_LIBRARY);
        if (in == null) {
            throw new ConfigException("Default library " + DEFAULT_LIBRARY
                    + " is not on the class path");
        }
        try (in) {
            return readLibrary(in, DEFAULT_LIBRARY);
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + DEFAULT_LIBRARY, e);
        }
    }

    public static ConfigLibrary readLibrary(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return readLibrary(in, path.toString());
        } catch (IOException e) {
            throw new ConfigException("Failed to read library file " + path, e);
        }
    }

    /**
     * Reads a library from YAML.
     *
     * @param source name of the input, used in error messages
     */
    public static ConfigLibrary readLibrary(InputStream in, String source) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new ConfigException("Failed to parse library file " + source, e);
        }
        Builder builder = new Builder();
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigException(source + ": expected a mapping at top level");
            }
            new YAMLReader(source, builder).read(root);
        }
        ConfigLibrary library = builder.build();
        logger.info("Loaded library {}: {} allocation groups, {} functions",
                source, builder.nextFamily - 1, builder.knownFunctions.size());
        return library;
    }

    @Override
    public Optional<AllocFunc> getAllocator(CallExp call) {
        return lookup(allocators, call);
    }

    @Override
    public Optional<AllocFunc> getDeallocator(CallExp call) {
        return lookup(deallocators, call);
    }

    @Override
    public Optional<AllocFunc> getDeallocator(String functionName) {
        return Optional.ofNullable(deallocators.get(functionName));
    }

    @Override
    public Optional<AllocFunc> getReallocator(CallExp call) {
        return lookup(reallocators, call);
    }

    private Optional<AllocFunc> lookup(Map<String, AllocFunc> funcs, CallExp call) {
        if (!isLibraryFunction(call)) {
            return Optional.empty();
        }
        return Optional.ofNullable(funcs.get(getFunctionName(call)));
    }

    /**
     * Calls of constructors and of functions defined in the program
     * never match library declarations.
     */
    private static boolean isLibraryFunction(CallExp call) {
        return !call.isConstructor()
                && (call.getFunction() == null || !call.getFunction().hasBody());
    }

    @Override
    public boolean isSmartPointer(CallExp call) {
        return call.isConstructor() && smartPointers.contains(call.getName());
    }

    @Override
    public Set<Direction> getArgDirection(CallExp call, int argNr) {
        if (!isLibraryFunction(call)) {
            return Set.of();
        }
        Map<Integer, Set<Direction>> args = directions.get(getFunctionName(call));
        if (args == null) {
            return Set.of();
        }
        return args.getOrDefault(argNr, Set.of());
    }

    @Override
    public boolean isLeakIgnore(String functionName) {
        return leakIgnore.contains(functionName);
    }

    @Override
    public boolean isUse(String functionName) {
        return use.contains(functionName);
    }

    @Override
    public OptionalInt getReturnedArg(CallExp call) {
        Integer arg = isLibraryFunction(call)
                ? returnArgs.get(getFunctionName(call)) : null;
        return arg == null ? OptionalInt.empty() : OptionalInt.of(arg);
    }

    @Override
    public boolean isResource(int family) {
        return resourceFamilies.contains(family);
    }

    @Override
    public Optional<Boolean> isNoReturn(CallExp call) {
        if (!isLibraryFunction(call)) {
            return Optional.empty();
        }
        String name = getFunctionName(call);
        Boolean value = noReturn.get(name);
        if (value != null) {
            return Optional.of(value);
        }
        if (allocators.containsKey(name) || deallocators.containsKey(name)
                || reallocators.containsKey(name) || leakIgnore.contains(name)
                || use.contains(name) || returnArgs.containsKey(name)
                || directions.containsKey(name)) {
            return Optional.of(false);
        }
        return Optional.empty();
    }

    @Override
    public boolean isContainerBuiltin(CallExp call) {
        return containerBuiltins.contains(getFunctionName(call));
    }

    /**
     * Member functions are named after the class of the receiver,
     * e.g., {@code std::string::c_str}; if that class is unknown,
     * the name is empty.
     */
    @Override
    public String getFunctionName(CallExp call) {
        Exp receiver = call.getReceiver();
        if (receiver == null) {
            return call.getName();
        }
        if (receiver instanceof VarExp varExp) {
            Type type = varExp.getVar().getType();
            if (type instanceof PointerType pointer) {
                type = pointer.pointee();
            }
            if (type instanceof ClassType || type instanceof ContainerType) {
                return type.getName() + "::" + call.getName();
            }
        }
        return "";
    }

    /**
     * Assembles a {@link ConfigLibrary}.
     */
    public static class Builder {

        private int nextFamily = 1;

        private final Map<String, AllocFunc> allocators = new HashMap<>();

        private final Map<String, AllocFunc> deallocators = new HashMap<>();

        private final Map<String, AllocFunc> reallocators = new HashMap<>();

        private final Set<Integer> resourceFamilies = new HashSet<>();

        private final Map<String, Boolean> noReturn = new HashMap<>();

        private final Set<String> leakIgnore = new HashSet<>();

        private final Set<String> use = new HashSet<>();

        private final Map<String, Integer> returnArgs = new HashMap<>();

        private final Map<String, Map<Integer, Set<Direction>>> directions = new HashMap<>();

        private final Set<String> containerBuiltins = new HashSet<>();

        private final Set<String> smartPointers = new HashSet<>();

        private final Set<String> knownFunctions = new HashSet<>();

        private Builder() {
        }

        /**
         * Declares a new allocation group.
         *
         * @return the family of the group.
         */
        public int newGroup(boolean resource) {
            int family = nextFamily++;
            if (resource) {
                resourceFamilies.add(family);
            }
            return family;
        }

        public Builder allocator(String name, int family) {
            return put(allocators, "allocator", name, AllocFunc.allocator(family));
        }

        public Builder outParamAllocator(String name, int family, int arg) {
            return put(allocators, "allocator", name,
                    AllocFunc.outParamAllocator(family, arg));
        }

        public Builder deallocator(String name, int family) {
            return deallocator(name, family, 1);
        }

        public Builder deallocator(String name, int family, int arg) {
            return put(deallocators, "deallocator", name,
                    AllocFunc.deallocator(family, arg));
        }

        public Builder reallocator(String name, int family, int reallocArg) {
            return put(reallocators, "reallocator", name,
                    AllocFunc.reallocator(family, reallocArg));
        }

        private Builder put(Map<String, AllocFunc> funcs, String role,
                            String name, AllocFunc func) {
            if (funcs.putIfAbsent(name, func) != null) {
                throw new ConfigException("Function " + name
                        + " is declared as " + role + " more than once");
            }
            knownFunctions.add(name);
            return this;
        }

        public Builder noReturn(String name, boolean value) {
            noReturn.put(name, value);
            knownFunctions.add(name);
            return this;
        }

        public Builder leakIgnore(String name) {
            leakIgnore.add(name);
            knownFunctions.add(name);
            return this;
        }

        public Builder use(String name) {
            use.add(name);
            knownFunctions.add(name);
            return this;
        }

        public Builder returnArg(String name, int argNr) {
            returnArgs.put(name, argNr);
            knownFunctions.add(name);
            return this;
        }

        public Builder direction(String name, int argNr, Direction first, Direction... rest) {
            directions.computeIfAbsent(name, k -> new HashMap<>())
                    .computeIfAbsent(argNr, k -> EnumSet.noneOf(Direction.class))
                    .addAll(EnumSet.of(first, rest));
            knownFunctions.add(name);
            return this;
        }

        public Builder containerBuiltin(String name) {
            containerBuiltins.add(name);
            knownFunctions.add(name);
            return this;
        }

        public Builder smartPointer(String className) {
            smartPointers.add(className);
            return this;
        }

        public ConfigLibrary build() {
            return new ConfigLibrary(this);
        }
    }

    /**
     * Translates the YAML tree of a library file into {@link Builder} calls.
     */
    private record YAMLReader(String source, Builder builder) {

        void read(JsonNode root) {
            Iterator<String> keys = root.fieldNames();
            while (keys.hasNext()) {
                String key = keys.next();
                JsonNode value = root.get(key);
                switch (key) {
                    case "groups" -> elements(value, key).forEach(this::readGroup);
                    case "functions" -> readFunctions(value);
                    case "smart-pointers" -> elements(value, key)
                            .forEach(n -> builder.smartPointer(text(n, key)));
                    default -> throw error("unknown key '" + key + "'");
                }
            }
        }

        private void readGroup(JsonNode group) {
            String kind = group.path("kind").asText("memory");
            boolean resource = switch (kind) {
                case "memory" -> false;
                case "resource" -> true;
                default -> throw error("unknown group kind '" + kind + "'");
            };
            int family = builder.newGroup(resource);
            elements(group.path("alloc"), "alloc").forEach(n -> {
                String name = text(n.path("name"), "alloc name");
                int arg = n.path("arg").asInt(AllocFunc.RETURNED);
                if (arg == AllocFunc.RETURNED) {
                    builder.allocator(name, family);
                } else {
                    builder.outParamAllocator(name, family, arg);
                }
            });
            elements(group.path("dealloc"), "dealloc").forEach(n ->
                    builder.deallocator(text(n.path("name"), "dealloc name"),
                            family, n.path("arg").asInt(1)));
            elements(group.path("realloc"), "realloc").forEach(n ->
                    builder.reallocator(text(n.path("name"), "realloc name"),
                            family, n.path("realloc-arg").asInt(1)));
        }

        private void readFunctions(JsonNode functions) {
            if (!functions.isObject()) {
                throw error("'functions' must be a mapping");
            }
            Iterator<Map.Entry<String, JsonNode>> it = functions.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String name = entry.getKey();
                JsonNode info = entry.getValue();
                if (info.has("noreturn")) {
                    builder.noReturn(name, info.get("noreturn").asBoolean());
                }
                if (info.path("leak-ignore").asBoolean(false)) {
                    builder.leakIgnore(name);
                }
                if (info.path("use").asBoolean(false)) {
                    builder.use(name);
                }
                if (info.has("return-arg")) {
                    builder.returnArg(name, info.get("return-arg").asInt());
                }
                if (info.path("container").asBoolean(false)) {
                    builder.containerBuiltin(name);
                }
                JsonNode args = info.path("args");
                if (args.isObject()) {
                    Iterator<Map.Entry<String, JsonNode>> argIt = args.fields();
                    while (argIt.hasNext()) {
                        Map.Entry<String, JsonNode> arg = argIt.next();
                        int argNr = parseArgNr(name, arg.getKey());
                        elements(arg.getValue(), "direction").forEach(d ->
                                builder.direction(name, argNr, parseDirection(d)));
                    }
                }
            }
        }

        private int parseArgNr(String function, String key) {
            try {
                return Integer.parseInt(key);
            } catch (NumberFormatException e) {
                throw new ConfigException(source + ": illegal argument number '"
                        + key + "' of " + function, e);
            }
        }

        private Direction parseDirection(JsonNode node) {
            try {
                return Direction.of(text(node, "direction"));
            } catch (IllegalArgumentException e) {
                throw new ConfigException(source + ": illegal direction "
                        + node.asText(), e);
            }
        }

        private Iterable<JsonNode> elements(JsonNode node, String what) {
            if (node.isMissingNode() || node.isNull()) {
                return Collections.emptyList();
            }
            if (!node.isArray()) {
                throw error("'" + what + "' must be a list");
            }
            return node;
        }

        private String text(JsonNode node, String what) {
            if (!node.isValueNode() || node.asText().isBlank()) {
                throw error("missing " + what);
            }
            return node.asText();
        }

        private ConfigException error(String message) {
            return new ConfigException(source + ": " + message);
        }
    }
}
