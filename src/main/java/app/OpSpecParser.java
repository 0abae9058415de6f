package app;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import ops.ValidationException;
import pipeline.Operation;

/**
 * Command line operation syntax: {@code kind[:name=value;name=value...]},
 * e.g. {@code crop:x=0;y=0;w=64;h=64} or {@code pixelate:size=4;region=0,0,32,32}.
 * Values stay strings; the registry parses and range-checks them.
 */
final class OpSpecParser {

    private OpSpecParser() {
    }

    static Operation parse(String spec) throws ValidationException {
        String s = spec.trim();
        int colon = s.indexOf(':');
        String kind = colon < 0 ? s : s.substring(0, colon).trim();
        Map<String, String> params = colon < 0 ? Map.of() : parseAssignments(kind, s.substring(colon + 1), ';');
        return Operation.of(kind, params);
    }

    /** {@code name=value} pairs separated by {@code sep}; blank entries are skipped. */
    static Map<String, String> parseAssignments(String kind, String text, char sep) throws ValidationException {
        Map<String, String> out = new LinkedHashMap<>();
        for (String part : text.split(Pattern.quote(String.valueOf(sep)))) {
            if (part.isBlank())
                continue;
            addAssignment(out, kind, part);
        }
        return out;
    }

    /** {@code --var name=value} flags. */
    static Map<String, String> parseVariables(List<String> vars) throws ValidationException {
        Map<String, String> out = new LinkedHashMap<>();
        for (String v : vars)
            addAssignment(out, null, v);
        return out;
    }

    private static void addAssignment(Map<String, String> out, String kind, String part) throws ValidationException {
        int eq = part.indexOf('=');
        if (eq <= 0)
            throw new ValidationException(kind, part.trim(), "expected name=value");
        String name = part.substring(0, eq).trim();
        if (out.put(name, part.substring(eq + 1).trim()) != null)
            throw new ValidationException(kind, name, "given more than once");
    }
}
