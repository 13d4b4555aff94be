package enricher.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed command line: {@code <command> [--name value | --name=value | --flag | positional]...}.
 * A single leading dash is accepted too ({@code -rows 50}).
 */
public final class Args {

    private final String command;
    private final Map<String, String> options;
    private final Set<String> flags;
    private final List<String> positionals;

    private Args(String command, Map<String, String> options, Set<String> flags, List<String> positionals) {
        this.command = command;
        this.options = options;
        this.flags = flags;
        this.positionals = positionals;
    }

    /**
     * @param booleanFlags option names that take no value
     * @throws IllegalArgumentException if a value option is last on the line
     */
    public static Args parse(String[] argv, Set<String> booleanFlags) {
        String command = null;
        Map<String, String> options = new HashMap<>();
        Set<String> flags = new HashSet<>();
        List<String> positionals = new ArrayList<>();

        for (int i = 0; i < argv.length; i++) {
            String s = argv[i];
            if (command == null && !s.startsWith("-")) {
                command = s;
                continue;
            }
            if (s.startsWith("-") && s.length() > 1 && !isNumber(s)) {
                String name = s.startsWith("--") ? s.substring(2) : s.substring(1);
                int eq = name.indexOf('=');
                if (eq >= 0) {
                    options.put(name.substring(0, eq), name.substring(eq + 1));
                } else if (booleanFlags.contains(name)) {
                    flags.add(name);
                } else if (i + 1 < argv.length) {
                    options.put(name, argv[++i]);
                } else {
                    throw new IllegalArgumentException("-" + (s.startsWith("--") ? "-" : "") + name + " requires a value");
                }
            } else {
                positionals.add(s);
            }
        }
        return new Args(command, options, flags, positionals);
    }

    private static boolean isNumber(String s) {
        try {
            Double.parseDouble(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /** First non-option word, or null. */
    public String command() {
        return command;
    }

    public String string(String name) {
        return options.get(name);
    }

    public String string(String name, String def) {
        String v = options.get(name);
        return v == null ? def : v;
    }

    /**
     * @throws IllegalArgumentException if present but not an integer
     */
    public int integer(String name, int def) {
        String v = options.get(name);
        if (v == null)
            return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: " + v);
        }
    }

    public boolean has(String name) {
        return options.containsKey(name) || flags.contains(name);
    }

    public boolean flag(String name) {
        return flags.contains(name);
    }

    public List<String> positionals() {
        return positionals;
    }

    /** Named option, falling back to the first positional. */
    public String stringOrPositional(String name) {
        String v = options.get(name);
        if (v != null)
            return v;
        return positionals.isEmpty() ? null : positionals.get(0);
    }
}
