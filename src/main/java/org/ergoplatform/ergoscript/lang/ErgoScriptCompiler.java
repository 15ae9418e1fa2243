package org.ergoplatform.ergoscript.lang;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/** Bundled {@link ContractCompiler} for the supported ErgoScript subset. */
public final class ErgoScriptCompiler implements ContractCompiler {
    private static final Pattern DOC_COMMENT = Pattern.compile("/\\*((?:(?!\\*/).)*)\\*/\\s*@contract", Pattern.DOTALL);
    private static final Pattern PARAM_DOC = Pattern.compile("@param\\s+(\\w+)\\s*(.*)");

    @Override
    public CompilationResult compile(String source, CompileOptions options) {
        var parsed = new Parser(source).parse();
        var body = parsed.body();
        var proposition = toProposition(body);
        if (parsed.template().isEmpty()) {
            return new CompilationResult(proposition, ErgoTree.fromProposition(options.treeVersion(), proposition), Optional.empty());
        }
        var header = parsed.template().get();
        var docs = parseDocComment(source);
        var parameters = new ArrayList<ContractTemplate.Parameter>();
        var types = new ArrayList<SType>();
        var defaults = new ArrayList<Optional<Object>>();
        for (var parameter : header.parameters()) {
            parameters.add(new ContractTemplate.Parameter(parameter.name(),
                docs.parameters().getOrDefault(parameter.name(), ""), parameters.size()));
            types.add(parameter.type());
            defaults.add(parameter.defaultValue());
        }
        var template = new ContractTemplate(header.name(), docs.description(), parameters, types, defaults, proposition);
        return new CompilationResult(proposition, template.defaultTree(options.treeVersion()), Optional.of(template));
    }

    private static Expr toProposition(Expr body) {
        if (SType.SIGMA_PROP.equals(body.type())) {
            return body;
        }
        if (SType.BOOLEAN.equals(body.type())) {
            return new Expr.UnaryOp(OpCode.BOOL_TO_SIGMA_PROP, body, SType.SIGMA_PROP, body.source().orElse(null));
        }
        throw new CompilerException("Contract must evaluate to Boolean or SigmaProp, got " + body.type(),
            body.source().orElse(null));
    }

    private record DocComment(String description, Map<String, String> parameters) {
    }

    private static DocComment parseDocComment(String source) {
        var matcher = DOC_COMMENT.matcher(source);
        String comment = null;
        while (matcher.find()) {
            comment = matcher.group(1);
        }
        if (comment == null) {
            return new DocComment("", Map.of());
        }
        var description = new StringBuilder();
        var parameters = new HashMap<String, String>();
        for (var rawLine : comment.split("\n")) {
            var line = rawLine.strip();
            while (line.startsWith("*")) {
                line = line.substring(1).strip();
            }
            var param = PARAM_DOC.matcher(line);
            if (param.find()) {
                parameters.put(param.group(1), param.group(2).strip());
            } else if (!line.isEmpty()) {
                if (description.length() > 0) {
                    description.append(' ');
                }
                description.append(line);
            }
        }
        return new DocComment(description.toString(), parameters);
    }
}
