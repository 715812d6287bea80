package com.cypher.guard.sanitizer;

import java.util.List;

/**
 * The rule table used by {@link QuerySanitizer}.
 *
 * <p>Rules run on text whose string literals and comments have been masked and whose
 * backticks have been blanked, so procedure names are matched with optional whitespace
 * around every dot ({@code `apoc`.`load`.json} reads as {@code apoc . load .json}).
 * Any change to the table bumps {@link #VERSION}; every rule is covered by a regression test.</p>
 */
public final class SanitizerRules {

    public static final String VERSION = "2024.3";

    private static final String DOT = "\\s*\\.\\s*";

    public static final List<PatternRule> DANGEROUS = List.of(
            // File system
            PatternRule.of("fs.load-csv", RuleGroup.FILESYSTEM,
                    "\\bLOAD\\s+CSV\\b", "LOAD CSV file access"),
            PatternRule.of("fs.apoc-load", RuleGroup.FILESYSTEM,
                    "\\bapoc" + DOT + "load" + DOT, "APOC load procedures"),
            PatternRule.of("fs.apoc-export", RuleGroup.FILESYSTEM,
                    "\\bapoc" + DOT + "export" + DOT, "APOC export procedures"),
            PatternRule.of("fs.apoc-import", RuleGroup.FILESYSTEM,
                    "\\bapoc" + DOT + "import" + DOT, "APOC import procedures"),
            PatternRule.of("fs.apoc-log", RuleGroup.FILESYSTEM,
                    "\\bapoc" + DOT + "log" + DOT, "APOC log procedures"),

            // Dynamic code
            PatternRule.of("code.apoc-cypher", RuleGroup.DYNAMIC_CODE,
                    "\\bapoc" + DOT + "cypher" + DOT + "(run\\w*|doIt|parallel\\w*|mapParallel\\w*)",
                    "dynamic Cypher execution"),
            PatternRule.of("code.apoc-periodic", RuleGroup.DYNAMIC_CODE,
                    "\\bapoc" + DOT + "periodic" + DOT + "(iterate|commit|submit|repeat|schedule)",
                    "background or batched execution"),
            PatternRule.of("code.apoc-do", RuleGroup.DYNAMIC_CODE,
                    "\\bapoc" + DOT + "do" + DOT, "conditional dynamic execution"),

            // Administrative and system
            PatternRule.of("admin.dbms-security", RuleGroup.ADMINISTRATIVE,
                    "\\bdbms" + DOT + "security" + DOT, "security administration"),
            PatternRule.of("admin.dbms-cluster", RuleGroup.ADMINISTRATIVE,
                    "\\bdbms" + DOT + "cluster" + DOT, "cluster administration"),
            PatternRule.of("admin.dbms-kill", RuleGroup.ADMINISTRATIVE,
                    "\\bdbms" + DOT + "killQuer", "query termination"),
            PatternRule.of("admin.dbms-config", RuleGroup.ADMINISTRATIVE,
                    "\\bdbms" + DOT + "setConfigValue\\b", "runtime configuration change"),
            PatternRule.of("admin.apoc-trigger", RuleGroup.ADMINISTRATIVE,
                    "\\bapoc" + DOT + "trigger" + DOT, "trigger management"),
            PatternRule.of("admin.apoc-systemdb", RuleGroup.ADMINISTRATIVE,
                    "\\bapoc" + DOT + "systemdb" + DOT, "system database access"),
            PatternRule.of("admin.apoc-config", RuleGroup.ADMINISTRATIVE,
                    "\\bapoc" + DOT + "config" + DOT, "server configuration access"),

            // Statement chaining: a separator followed by anything but whitespace
            PatternRule.of("chain.separator", RuleGroup.CHAINING,
                    ";\\s*\\S", "multiple statements"),

            // Huge iteration: six or more digits in a range bound
            PatternRule.of("iter.huge-range", RuleGroup.ITERATION,
                    "\\b(FOREACH|UNWIND)\\b[^;]*?\\brange\\s*\\(\\s*-?\\d+\\s*,\\s*\\d{6,}",
                    "iteration over a huge range")
    );

    public static final List<PatternRule> SUSPICIOUS = List.of(
            PatternRule.of("proc.apoc", RuleGroup.PROCEDURE_CALL,
                    "\\bCALL\\s+apoc" + DOT, "APOC procedure call"),
            PatternRule.of("proc.dbms", RuleGroup.PROCEDURE_CALL,
                    "\\bCALL\\s+dbms" + DOT, "DBMS procedure call"),
            PatternRule.of("schema.create-index", RuleGroup.SCHEMA_CHANGE,
                    "\\bCREATE\\s+(\\w+\\s+)?INDEX\\b", "index creation"),
            PatternRule.of("schema.drop-index", RuleGroup.SCHEMA_CHANGE,
                    "\\bDROP\\s+INDEX\\b", "index removal"),
            PatternRule.of("schema.create-constraint", RuleGroup.SCHEMA_CHANGE,
                    "\\bCREATE\\s+CONSTRAINT\\b", "constraint creation"),
            PatternRule.of("schema.drop-constraint", RuleGroup.SCHEMA_CHANGE,
                    "\\bDROP\\s+CONSTRAINT\\b", "constraint removal"),
            PatternRule.of("concat.literals", RuleGroup.CONCATENATION,
                    "['\"]\\s*\\+\\s*['\"]", "string literal concatenation")
    );

    private SanitizerRules() {
        // utility class
    }
}
