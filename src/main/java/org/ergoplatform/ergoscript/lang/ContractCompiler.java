package org.ergoplatform.ergoscript.lang;

/** Compiles ErgoScript source text into a typed tree and an {@link ErgoTree}. */
public interface ContractCompiler {

    /**
     * @throws CompilerException for lexical, syntax and type errors
     */
    CompilationResult compile(String source, CompileOptions options);

    /** Whether {@code source} declares an EIP-5 template or template parameter docs. */
    static boolean isTemplate(String source) {
        return source.contains("@contract") || source.contains("@param");
    }
}
