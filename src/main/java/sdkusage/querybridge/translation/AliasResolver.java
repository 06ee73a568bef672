package sdkusage.querybridge.translation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps colloquial product names ("js", "golang", "az") to the canonical literals of the schema.
 *
 * <p>Canonical literals mentioned verbatim always win; the alias table is only consulted when the text
 * names no canonical value directly, and its results are filtered to the values the schema offers.</p>
 */
public class AliasResolver {

    private static final Map<String, List<String>> ALIASES = new LinkedHashMap<>();

    static {
        List<String> javascript = List.of("JavaScript", "JavaScript (Node.JS)", "JavaScript RLC");
        List<String> node = List.of("JavaScript (Node.JS)");
        List<String> dotnet = List.of(".Net Code-gen", ".Net Fluent");
        List<String> java = List.of("Java Fluent Lite", "Java Fluent Premium");

        ALIASES.put("js", javascript);
        ALIASES.put("javascript", javascript);
        ALIASES.put("node", node);
        ALIASES.put("nodejs", node);
        ALIASES.put("node.js", node);
        ALIASES.put("rlc", List.of("JavaScript RLC"));
        ALIASES.put(".net", dotnet);
        ALIASES.put("dotnet", dotnet);
        ALIASES.put("csharp", dotnet);
        ALIASES.put("c#", dotnet);
        ALIASES.put("net", dotnet);
        ALIASES.put("java", java);
        ALIASES.put("python", List.of("Python-SDK"));
        ALIASES.put("py", List.of("Python-SDK"));
        ALIASES.put("go", List.of("Go-SDK"));
        ALIASES.put("golang", List.of("Go-SDK"));
        ALIASES.put("php", List.of("PHP-SDK"));
        ALIASES.put("ruby", List.of("Ruby-SDK"));
        ALIASES.put("rb", List.of("Ruby-SDK"));
        ALIASES.put("rust", List.of("Rust"));
        ALIASES.put("rs", List.of("Rust"));
        ALIASES.put("cli", List.of("AzureCLI"));
        ALIASES.put("azure-cli", List.of("AzureCLI"));
        ALIASES.put("az", List.of("AzureCLI"));
        ALIASES.put("powershell", List.of("AzurePowershell"));
        ALIASES.put("ps", List.of("AzurePowershell"));
        ALIASES.put("pwsh", List.of("AzurePowershell"));
        ALIASES.put("terraform", List.of("Terraform"));
        ALIASES.put("tf", List.of("Terraform"));
        ALIASES.put("ansible", List.of("Ansible"));
        ALIASES.put("vscode", List.of("VS Code Azure Extension"));
        ALIASES.put("vs-code", List.of("VS Code Azure Extension"));
        ALIASES.put("visual-studio-code", List.of("VS Code Azure Extension"));
    }

    /**
     * Canonical values named by {@code text}, in the order of {@code canonicalValues} for direct
     * mentions and of the alias table otherwise. Empty when nothing matches.
     */
    public Set<String> resolve(String text, Collection<String> canonicalValues) {
        Set<String> matches = new LinkedHashSet<>();
        if (text == null || text.isBlank() || canonicalValues == null || canonicalValues.isEmpty()) {
            return matches;
        }

        for (String canonical : canonicalValues) {
            if (Terms.containsTerm(text, canonical)) {
                matches.add(canonical);
            }
        }
        if (!matches.isEmpty()) {
            return matches;
        }

        for (Map.Entry<String, List<String>> alias : ALIASES.entrySet()) {
            if (!Terms.containsTerm(text, alias.getKey())) {
                continue;
            }
            for (String target : alias.getValue()) {
                if (canonicalValues.contains(target)) {
                    matches.add(target);
                }
            }
        }
        return matches;
    }

    /**
     * Aliases that lead to {@code canonical}.
     */
    public List<String> aliasesFor(String canonical) {
        List<String> aliases = new ArrayList<>();
        for (Map.Entry<String, List<String>> alias : ALIASES.entrySet()) {
            if (alias.getValue().contains(canonical)) {
                aliases.add(alias.getKey());
            }
        }
        return aliases;
    }

    public Map<String, List<String>> allAliases() {
        return Collections.unmodifiableMap(ALIASES);
    }
}
