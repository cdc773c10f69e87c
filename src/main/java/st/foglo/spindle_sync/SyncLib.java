package st.foglo.spindle_sync;

// spindle-sync - aligns CNC spindle frequency timelines with audio recordings
//
// Copyright (C) 2020 Rabbe Fogelholm
//
// This program is free software: you can redistribute it and/or modify
// it under the terms of the GNU General Public License as published by
// the Free Software Foundation, either version 3 of the License, or
// (at your option) any later version.
//
// This program is distributed in the hope that it will be useful,
// but WITHOUT ANY WARRANTY; without even the implied warranty of
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
// GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public License
// along with this program.  If not, see <http://www.gnu.org/licenses/>.

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringTokenizer;

/**
 * Command line handling and diagnostic messages.
 */
public final class SyncLib {

    /**
     * Messages above this level are suppressed: 1 shows info,
     * 2 debug and 3 trace. Warnings are always shown.
     */
    private static volatile int verbosity = 0;

    public static void setVerbosity(int level) {
        verbosity = level;
    }

    public static int getVerbosity() {
        return verbosity;
    }

    /**
     * A registry of options and the values given on the command line.
     * Each instance is independent; nothing is shared between instances.
     */
    public static final class Options {

        /**
         * Maps full parameter name to value, represented as a string.
         */
        private final Map<String, String> params = new HashMap<String, String>();

        /**
         * Maps full parameter name to default.
         */
        private final Map<String, String> defaults = new HashMap<String, String>();

        /**
         * Maps short parameter name to option.
         */
        private final Map<String, Option> opts = new HashMap<String, Option>();

        /**
         * Command-line arguments.
         */
        private final List<String> args = new ArrayList<String>();

        void register(Option o) {
            if (opts.get(o.shortName) != null) {
                throw new ConfigException("duplicate option: %s", o.shortName);
            }
            if (defaults.get(o.name) != null) {
                throw new ConfigException("duplicate parameter name: %s", o.name);
            }
            opts.put(o.shortName, o);
            defaults.put(o.name, o.defaultValue);
        }

        public void parseArgs(String[] cliArgs) {

            boolean parsingOptions = true;
            for (int k = 0; k < cliArgs.length; ) {

                if (cliArgs[k].equals("--")) {
                    parsingOptions = false;
                    k++;
                }
                else if (parsingOptions && cliArgs[k].startsWith("-") && cliArgs[k].length() > 1) {
                    final String name = cliArgs[k].substring(1,2);
                    final Option o = opts.get(name);
                    if (o == null) {
                        throw new ConfigException("unknown option: %s", name);
                    }
                    k = o.action(this, k, cliArgs);
                }
                else {
                    args.add(cliArgs[k]);
                    k++;
                }
            }
        }

        public String getOpt(String key) {
            final String value = params.get(key);
            final String result = value != null ? value : defaults.get(key);
            if (result == null) {
                throw new ConfigException("no such parameter: %s", key);
            }
            return result;
        }

        public boolean getFlag(String key) {
            return getOpt(key).equals("true");
        }

        public int getIntOpt(String key) {
            final String value = getOpt(key);
            try {
                return Integer.parseInt(value);
            }
            catch (NumberFormatException e) {
                throw new ConfigException("option -%s: expecting an integer, got: %s",
                        getOptShortName(key), value);
            }
        }

        public double getDoubleOpt(String key) {
            final String value = getOpt(key);
            try {
                return Double.parseDouble(value);
            }
            catch (NumberFormatException e) {
                throw new ConfigException("option -%s: expecting a number, got: %s",
                        getOptShortName(key), value);
            }
        }

        public double[] getDoubleOptMulti(String key) {
            final String multiValue = getOpt(key);
            final StringTokenizer st = new StringTokenizer(multiValue, ",");
            final double[] result = new double[st.countTokens()];
            for (int k = 0; k < result.length; k++) {
                final String token = st.nextToken();
                try {
                    result[k] = Double.parseDouble(token);
                }
                catch (NumberFormatException e) {
                    throw new ConfigException("option -%s: expecting numbers, got: %s",
                            getOptShortName(key), multiValue);
                }
            }
            return result;
        }

        public String getDefault(String key) {
            return defaults.get(key);
        }

        public String getOptShortName(String key) {
            for (Option o : opts.values()) {
                if (o.name.equals(key)) {
                    return o.shortName;
                }
            }
            return "?";
        }

        public String getArgument(int i) {
            return args.get(i);
        }

        public int nofArguments() {
            return args.size();
        }
    }

    public abstract static class Option {

        final String shortName;
        final String name;
        final String defaultValue;

        public Option(Options options, String shortName, String name, String defaultValue) {
            this.shortName = shortName;
            this.name = name;
            this.defaultValue = defaultValue;
            options.register(this);
        }

        /**
         * The index k points to the argument entity being processed. The
         * value returned should be set for continued processing.
         */
        abstract int action(Options options, int k, String[] cliArgs);
    }

    public static class Flag extends Option {

        public Flag(Options options, String shortName, String name) {
            super(options, shortName, name, "false");
        }

        int action(Options options, int k, String[] cliArgs) {
            options.params.put(this.name, "true");
            if (cliArgs[k].length() > 2) {
                cliArgs[k] = "-" + cliArgs[k].substring(2);
                return k;
            }
            else {
                return k+1;
            }
        }
    }

    public static class SteppingOption extends Option {

        public SteppingOption(Options options, String shortName, String name) {
            super(options, shortName, name, "0");
        }

        int action(Options options, int k, String[] cliArgs) {
            final String value = options.params.get(this.name);
            if (value == null) {
                options.params.put(this.name, "1");
            }
            else {
                options.params.put(this.name, String.format("%d", Integer.parseInt(value)+1));
            }

            if (cliArgs[k].length() > 2) {
                cliArgs[k] = "-" + cliArgs[k].substring(2);
                return k;
            }
            else {
                return k+1;
            }
        }
    }

    public static class SingleValueOption extends Option {

        public SingleValueOption(Options options, String shortName, String name, String defaultValue) {
            super(options, shortName, name, defaultValue);
        }

        int action(Options options, int k, String[] cliArgs) {
            if (cliArgs[k].length() > 2) {
                final String value = cliArgs[k].substring(2);
                options.params.put(this.name, value);
                return k+1;
            }
            else if (k+1 < cliArgs.length) {
                options.params.put(this.name, cliArgs[k+1]);
                return k+2;
            }
            else {
                throw new ConfigException("option -%s requires a value", shortName);
            }
        }
    }

    public static class VersionOption extends Option {

        public VersionOption(Options options, String shortName, String name, String slogan) {
            super(options, shortName, name, slogan);
        }

        int action(Options options, int k, String[] cliArgs) {
            System.out.println(options.defaults.get(this.name));
            System.exit(0);
            return 0;
        }
    }

    public static class HelpOption extends Option {

        final String[] text;

        public HelpOption(Options options, String shortName, String[] text) {
            super(options, shortName, "help", "");
            this.text = text;
        }

        int action(Options options, int k, String[] cliArgs) {
            for (String line : text) {
                System.out.println(line);
            }
            System.exit(0);
            return 0;
        }
    }

    public static class Message {
        public Message(String prefix, String message, boolean output) {
            if (output) {
                System.err.printf("%s: %s%s", prefix, message, System.lineSeparator());
            }
        }
    }

    public static class Trace extends Message {
        public Trace(String message) {
            super("TRACE", message, verbosity >= 3);
        }

        public Trace(String format, Object... args) {
            this(verbosity >= 3 ? String.format(format, args) : format);
        }
    }

    public static class Debug extends Message {
        public Debug(String message) {
            super("DEBUG", message, verbosity >= 2);
        }

        public Debug(String format, Object... args) {
            this(verbosity >= 2 ? String.format(format, args) : format);
        }
    }

    public static class Info extends Message {
        public Info(String message) {
            super("INFO", message, verbosity >= 1);
        }

        public Info(String format, Object... args) {
            this(verbosity >= 1 ? String.format(format, args) : format);
        }
    }

    public static class Warning extends Message {
        public Warning(String message) {
            super("WARNING", message, true);
        }

        public Warning(String format, Object... args) {
            this(String.format(format, args));
        }
    }

    /**
     * Call any of the constructors to terminate unsuccessfully.
     */
    public static class Death extends Message {
        public Death(String message) {
            super("FATAL", message, true);
            System.exit(1);
        }

        public Death(String format, Object... args) {
            this(String.format(format, args));
        }

        public Death(Exception e) {
            this(String.format("exception: %s%s%s",
                    e.toString(),
                    System.lineSeparator(),
                    stackTraceAsString(e.getStackTrace())));
        }

        public static String stackTraceAsString(StackTraceElement[] stackTrace) {
            final StringBuilder sb = new StringBuilder();
            for (int k = 0; k < stackTrace.length; k++) {
                sb.append(stackTrace[k].toString());
                sb.append(System.lineSeparator());
            }
            return sb.toString();
        }
    }

    private SyncLib() {
    }
}
