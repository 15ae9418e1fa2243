package org.ergoplatform.ergoscript.lang;

/**
 * Operation kinds of the typed tree. {@link #opName()} is the single naming source shared by the
 * evaluator's cost trace and the source mappers.
 */
public enum OpCode {
    CONSTANT("Constant", "Constant value"),
    CONSTANT_PLACEHOLDER("ConstantPlaceholder", "Template parameter"),
    VAL_USE("ValUse", "Variable reference"),
    VAL_DEF("ValDef", "Variable definition"),
    BLOCK("BlockValue", "Block"),
    FUNC_VALUE("FuncValue", "Function"),
    APPLY("Apply", "Function call"),
    IF("If", "Conditional"),
    HEIGHT("Height", "Current block height"),
    SELF("Self", "Box being spent"),
    INPUTS("Inputs", "Transaction inputs"),
    OUTPUTS("Outputs", "Transaction outputs"),
    DATA_INPUTS("DataInputs", "Transaction data inputs"),
    PRE_HEADER("PreHeader", "Block pre-header"),
    GT("GT", "Greater than (>)"),
    LT("LT", "Less than (<)"),
    GE("GE", "Greater or equal (>=)"),
    LE("LE", "Less or equal (<=)"),
    EQ("EQ", "Equals (==)"),
    NEQ("NEQ", "Not equals (!=)"),
    PLUS("Plus", "Addition (+)"),
    MINUS("Minus", "Subtraction (-)"),
    MULTIPLY("Multiply", "Multiplication (*)"),
    DIVISION("Division", "Division (/)"),
    MODULO("Modulo", "Modulo (%)"),
    BIN_AND("BinAnd", "Logical AND (&&)"),
    BIN_OR("BinOr", "Logical OR (||)"),
    SIGMA_AND("SigmaAnd", "Sigma AND"),
    SIGMA_OR("SigmaOr", "Sigma OR"),
    LOGICAL_NOT("LogicalNot", "Logical NOT (!)"),
    NEGATION("Negation", "Negation (-)"),
    BOOL_TO_SIGMA_PROP("BoolToSigmaProp", "Boolean to SigmaProp"),
    UPCAST("Upcast", "Numeric widening"),
    DOWNCAST("Downcast", "Numeric narrowing"),
    EXTRACT_AMOUNT("ExtractAmount", "Box value"),
    EXTRACT_ID("ExtractId", "Box id"),
    EXTRACT_CREATION_INFO("ExtractCreationInfo", "Box creation info"),
    EXTRACT_REGISTER_AS("ExtractRegisterAs", "Box register"),
    TOKENS("Tokens", "Box tokens"),
    SIZE_OF("SizeOf", "Collection size"),
    BY_INDEX("ByIndex", "Collection element"),
    OPTION_GET("OptionGet", "Option value"),
    OPTION_IS_DEFINED("OptionIsDefined", "Option presence"),
    OPTION_GET_OR_ELSE("OptionGetOrElse", "Option value or default"),
    SELECT_FIELD("SelectField", "Tuple field"),
    PROPERTY_CALL("PropertyCall", "Pre-header property"),
    TUPLE("Tuple", "Tuple"),
    CONCRETE_COLLECTION("ConcreteCollection", "Collection literal"),
    MAP("Map", "Collection map"),
    FILTER("Filter", "Collection filter"),
    EXISTS("Exists", "Collection exists"),
    FOR_ALL("ForAll", "Collection forall"),
    FLAT_MAP("FlatMap", "Collection flatMap"),
    FOLD("Fold", "Collection fold"),
    AND("AND", "All of"),
    OR("OR", "Any of"),
    DECODE_POINT("DecodePoint", "Decode group element"),
    PROVE_DLOG("ProveDlog", "Discrete log proposition");

    private final String opName;
    private final String description;

    OpCode(String opName, String description) {
        this.opName = opName;
        this.description = description;
    }

    public String opName() {
        return opName;
    }

    public String description() {
        return description;
    }

    public boolean isCollectionLoop() {
        return this == MAP || this == FILTER || this == EXISTS || this == FOR_ALL || this == FLAT_MAP || this == FOLD;
    }

    public static OpCode byOpName(String name) {
        for (OpCode code : values()) {
            if (code.opName.equals(name)) {
                return code;
            }
        }
        return null;
    }
}
