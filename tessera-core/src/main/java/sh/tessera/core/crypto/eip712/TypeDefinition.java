// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto.eip712;

import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * EIP-712 type structure for a Java type: the primary type name, every struct
 * type it references, and a function that turns a message into field values.
 *
 * <pre>{@code
 * record AgentWalletBinding(BigInteger agentId, Address wallet, BigInteger nonce, BigInteger deadline) {
 *     static final TypeDefinition<AgentWalletBinding> DEFINITION = TypeDefinition.forRecord(
 *         AgentWalletBinding.class,
 *         "AgentWalletBinding",
 *         Map.of("AgentWalletBinding", List.of(
 *             TypedDataField.of("agentId", "uint256"),
 *             TypedDataField.of("wallet", "address"),
 *             TypedDataField.of("nonce", "uint256"),
 *             TypedDataField.of("deadline", "uint256"))));
 * }
 * }</pre>
 *
 * @param <T>         the Java type this definition maps
 * @param primaryType the primary type name
 * @param types       struct type name to its fields
 * @param extractor   reads field values from a message
 */
public record TypeDefinition<T>(
    String primaryType,
    Map<String, List<TypedDataField>> types,
    Function<T, Map<String, Object>> extractor
) {
    public TypeDefinition {
        Objects.requireNonNull(primaryType, "primaryType");
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(extractor, "extractor");
        if (!types.containsKey(primaryType)) {
            throw new IllegalArgumentException("types must contain primaryType: " + primaryType);
        }
    }

    /**
     * Creates a definition whose extractor reads record components by name.
     * Component names must match the field names of the primary type.
     *
     * @param <T>         the record type
     * @param recordClass the record class
     * @param primaryType the primary type name
     * @param types       struct type name to its fields
     * @return the definition
     * @throws IllegalArgumentException if {@code recordClass} is not a record
     */
    public static <T extends Record> TypeDefinition<T> forRecord(
            Class<T> recordClass,
            String primaryType,
            Map<String, List<TypedDataField>> types) {
        Objects.requireNonNull(recordClass, "recordClass");
        if (!recordClass.isRecord()) {
            throw new IllegalArgumentException("Class must be a record: " + recordClass.getName());
        }
        final RecordComponent[] components = recordClass.getRecordComponents();

        Function<T, Map<String, Object>> extractor = message -> {
            var values = new LinkedHashMap<String, Object>();
            for (RecordComponent component : components) {
                try {
                    values.put(component.getName(), component.getAccessor().invoke(message));
                } catch (ReflectiveOperationException e) {
                    throw new IllegalStateException(
                        "Failed to read '" + component.getName() + "' from " + recordClass.getName(), e);
                }
            }
            return values;
        };
        return new TypeDefinition<>(primaryType, types, extractor);
    }
}
