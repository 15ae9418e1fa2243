package org.ergoplatform.ergoscript.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * EIP-5 style contract template. Parameter values are bound as the segregated constants of the
 * resulting {@link ErgoTree}.
 */
public record ContractTemplate(
    String name,
    String description,
    List<Parameter> parameters,
    List<SType> constTypes,
    List<Optional<Object>> constValues,
    Expr expressionTree
) {
    public ContractTemplate {
        parameters = List.copyOf(parameters);
        constTypes = List.copyOf(constTypes);
        constValues = List.copyOf(constValues);
    }

    public record Parameter(String name, String description, int constantIndex) {
    }

    public Optional<Parameter> parameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }

    /**
     * Builds a tree with the given parameter values, falling back to declared defaults.
     *
     * @throws IllegalArgumentException when a parameter without default has no value or a value
     *     does not fit the parameter type
     */
    public ErgoTree applyTemplate(byte version, Map<String, Object> values) {
        for (var key : values.keySet()) {
            if (parameter(key).isEmpty()) {
                throw new IllegalArgumentException("Unknown template parameter '" + key + "' for contract " + name);
            }
        }
        var constants = new ArrayList<Expr.Constant>();
        for (var parameter : parameters) {
            int index = parameter.constantIndex();
            var type = constTypes.get(index);
            Object value;
            if (values.containsKey(parameter.name())) {
                value = convert(parameter.name(), values.get(parameter.name()), type);
            } else {
                value = constValues.get(index).orElseThrow(() -> new IllegalArgumentException(
                    "Missing value for template parameter '" + parameter.name() + "'"));
            }
            constants.add(new Expr.Constant(type, value, null));
        }
        return new ErgoTree(version, expressionTree, constants);
    }

    /** Tree bound to the declared defaults; parameters without default stay unbound. */
    public ErgoTree defaultTree(byte version) {
        var constants = new ArrayList<Expr.Constant>();
        for (int i = 0; i < constTypes.size(); i++) {
            constants.add(new Expr.Constant(constTypes.get(i), constValues.get(i).orElse(null), null));
        }
        return new ErgoTree(version, expressionTree, constants);
    }

    private static Object convert(String parameterName, Object value, SType type) {
        if (SType.isNumeric(type) && value instanceof Number) {
            try {
                return Numerics.convert(value, type);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Value " + value + " does not fit " + type + " parameter '" + parameterName + "'");
            }
        }
        if (SType.BOOLEAN.equals(type) && value instanceof Boolean) {
            return value;
        }
        if (!SType.isNumeric(type) && !SType.BOOLEAN.equals(type) && value != null && !(value instanceof Number)
            && !(value instanceof Boolean)) {
            return value;
        }
        throw new IllegalArgumentException("Parameter '" + parameterName + "' expects " + type + ", got " + value);
    }
}
