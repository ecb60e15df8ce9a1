package work.lcod.worlddata.script;

import java.util.Set;
import java.util.TreeSet;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

/**
 * {@link ScriptInspector} running JavaScript sources in a fresh GraalVM polyglot context per script.
 *
 * <p>A script describes itself like this:</p>
 *
 * <pre>{@code
 * function define(script) {
 *     script.name = "zone_boss";
 *     script.type = "ai";
 *     return 0;
 * }
 *
 * function prepare(self, server) { ... }
 * }</pre>
 */
public final class GraalScriptInspector implements ScriptInspector {
    private static final String LANGUAGE = "js";

    @Override
    public ScriptDefinition inspect(String path, String source) {
        try (Context context = Context
            .newBuilder(LANGUAGE)
            .allowHostAccess(HostAccess.NONE)
            .allowExperimentalOptions(true)
            .option("engine.WarnInterpreterOnly", "false")
            .build()) {

            try {
                context.eval(Source.newBuilder(LANGUAGE, source, path).buildLiteral());
            } catch (PolyglotException ex) {
                throw new InvalidScriptException("Improperly formatted script encountered: " + path, ex);
            }

            Value bindings = context.getBindings(LANGUAGE);
            Value define = bindings.getMember("define");
            if (define == null || !define.canExecute()) {
                throw new InvalidScriptException("Invalid script encountered: " + path);
            }

            Value script = context.eval(LANGUAGE, "({ name: '', type: '' })");
            Value result;
            try {
                result = define.execute(script);
            } catch (PolyglotException ex) {
                throw new InvalidScriptException("Script is not properly defined: " + path, ex);
            }
            String name = stringMember(script, "name");
            String type = stringMember(script, "type");
            if (result == null || !result.fitsInInt() || result.asInt() != 0 || name.isEmpty() || type.isEmpty()) {
                throw new InvalidScriptException("Script is not properly defined: " + path);
            }

            Set<String> functions = new TreeSet<>();
            for (String key : bindings.getMemberKeys()) {
                Value member = bindings.getMember(key);
                if (member != null && member.canExecute()) {
                    functions.add(key);
                }
            }
            return new ScriptDefinition(name, type, functions);
        }
    }

    private static String stringMember(Value object, String key) {
        Value member = object.getMember(key);
        if (member == null || member.isNull()) {
            return "";
        }
        return member.isString() ? member.asString() : member.toString();
    }
}
