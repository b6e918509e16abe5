// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto.eip712;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sh.tessera.core.abi.Words;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.error.Eip712Exception;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.primitives.Hex;

/**
 * EIP-712 {@code encodeType}, {@code encodeData} and {@code hashStruct}.
 *
 * <p>Supports atomic types ({@code uintN}, {@code intN}, {@code address},
 * {@code bool}, {@code bytesN}), dynamic {@code bytes} and {@code string}, and
 * nested structs. Arrays are not used by any registry message and are rejected.
 */
final class TypedDataEncoder {
    private TypedDataEncoder() {}

    /**
     * Canonical type string: primary type first, then referenced structs sorted by name.
     * Example: {@code Mail(Person from,Person to,string contents)Person(string name,address wallet)}
     */
    static String encodeType(String typeName, Map<String, List<TypedDataField>> types) {
        Set<String> deps = new LinkedHashSet<>();
        collectDependencies(typeName, types, deps, new HashSet<>());
        deps.remove(typeName);

        List<String> ordered = new ArrayList<>();
        ordered.add(typeName);
        deps.stream().sorted().forEach(ordered::add);

        var result = new StringBuilder();
        for (String t : ordered) {
            result.append(t).append('(');
            var fields = types.get(t);
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) result.append(',');
                result.append(fields.get(i).type()).append(' ').append(fields.get(i).name());
            }
            result.append(')');
        }
        return result.toString();
    }

    private static void collectDependencies(
            String typeName,
            Map<String, List<TypedDataField>> types,
            Set<String> deps,
            Set<String> visiting) {
        if (!visiting.add(typeName)) {
            throw Eip712Exception.cyclicDependency(typeName);
        }
        deps.add(typeName);
        for (var field : types.get(typeName)) {
            if (types.containsKey(field.type()) && !deps.contains(field.type())) {
                collectDependencies(field.type(), types, deps, visiting);
            }
        }
        visiting.remove(typeName);
    }

    static byte[] typeHash(String typeName, Map<String, List<TypedDataField>> types) {
        return Keccak256.hash(encodeType(typeName, types).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * hashStruct(s) = keccak256(typeHash || encodeData(s))
     */
    static byte[] hashStruct(String typeName, Map<String, List<TypedDataField>> types, Map<String, Object> data) {
        var fields = types.get(typeName);
        if (fields == null) {
            throw Eip712Exception.unknownType(typeName);
        }
        var encoded = new ByteArrayOutputStream();
        encoded.writeBytes(typeHash(typeName, types));
        for (var field : fields) {
            if (!data.containsKey(field.name())) {
                throw Eip712Exception.missingField(typeName, field.name());
            }
            encoded.writeBytes(encodeField(field.type(), data.get(field.name()), types));
        }
        return Keccak256.hash(encoded.toByteArray());
    }

    static Hash hashDomain(Eip712Domain domain) {
        var fields = new ArrayList<TypedDataField>();
        var data = new LinkedHashMap<String, Object>();
        if (domain.name() != null) {
            fields.add(TypedDataField.of("name", "string"));
            data.put("name", domain.name());
        }
        if (domain.version() != null) {
            fields.add(TypedDataField.of("version", "string"));
            data.put("version", domain.version());
        }
        if (domain.chainId() != null) {
            fields.add(TypedDataField.of("chainId", "uint256"));
            data.put("chainId", BigInteger.valueOf(domain.chainId()));
        }
        if (domain.verifyingContract() != null) {
            fields.add(TypedDataField.of("verifyingContract", "address"));
            data.put("verifyingContract", domain.verifyingContract());
        }
        if (domain.salt() != null) {
            fields.add(TypedDataField.of("salt", "bytes32"));
            data.put("salt", domain.salt());
        }
        return Hash.fromBytes(hashStruct("EIP712Domain", Map.of("EIP712Domain", fields), data));
    }

    @SuppressWarnings("unchecked")
    static byte[] encodeField(String type, Object value, Map<String, List<TypedDataField>> types) {
        if (value == null) {
            throw Eip712Exception.invalidValue(type, null);
        }
        if (types.containsKey(type)) {
            if (!(value instanceof Map<?, ?> map)) {
                throw Eip712Exception.invalidValue(type, value);
            }
            return hashStruct(type, types, (Map<String, Object>) map);
        }
        if (type.endsWith("]")) {
            throw Eip712Exception.unknownType(type);
        }
        try {
            switch (type) {
                case "address":
                    return Words.address(toAddress(value));
                case "bool":
                    if (!(value instanceof Boolean b)) {
                        throw Eip712Exception.invalidValue(type, value);
                    }
                    return Words.bool(b);
                case "string":
                    return Keccak256.hash(value.toString().getBytes(StandardCharsets.UTF_8));
                case "bytes":
                    return Keccak256.hash(toBytes(type, value));
                default:
                    break;
            }
            if (type.startsWith("uint")) {
                return Words.uint(toBigInteger(type, value), bits(type, "uint"));
            }
            if (type.startsWith("int")) {
                return Words.signed(toBigInteger(type, value), bits(type, "int"));
            }
            if (type.startsWith("bytes")) {
                int length = parseSize(type, "bytes", 1, 32);
                byte[] bytes = toBytes(type, value);
                if (bytes.length != length) {
                    throw Eip712Exception.invalidValue(type, bytes.length + " bytes");
                }
                return Words.fixedBytes(bytes);
            }
        } catch (IllegalArgumentException e) {
            throw new Eip712Exception("Cannot encode " + value + " as " + type, e);
        }
        throw Eip712Exception.unknownType(type);
    }

    private static int bits(String type, String prefix) {
        if (type.length() == prefix.length()) {
            return 256;
        }
        int bits = parseSize(type, prefix, 8, 256);
        if (bits % 8 != 0) {
            throw Eip712Exception.unknownType(type);
        }
        return bits;
    }

    private static int parseSize(String type, String prefix, int min, int max) {
        final int size;
        try {
            size = Integer.parseInt(type.substring(prefix.length()));
        } catch (NumberFormatException e) {
            throw Eip712Exception.unknownType(type);
        }
        if (size < min || size > max) {
            throw Eip712Exception.unknownType(type);
        }
        return size;
    }

    private static BigInteger toBigInteger(String type, Object value) {
        if (value instanceof BigInteger bi) {
            return bi;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        if (value instanceof String s) {
            return Hex.hasPrefix(s) ? new BigInteger(Hex.cleanPrefix(s), 16) : new BigInteger(s);
        }
        throw Eip712Exception.invalidValue(type, value);
    }

    private static Address toAddress(Object value) {
        if (value instanceof Address address) {
            return address;
        }
        if (value instanceof String s) {
            return new Address(s);
        }
        throw Eip712Exception.invalidValue("address", value);
    }

    private static byte[] toBytes(String type, Object value) {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof Hash hash) {
            return hash.toBytes();
        }
        if (value instanceof String s) {
            return Hex.decode(s);
        }
        throw Eip712Exception.invalidValue(type, value);
    }
}
