package com.cypher.guard.sanitizer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QuerySanitizer Tests")
class QuerySanitizerTest {

    private QuerySanitizer sanitizer;

    @BeforeEach
    void setUp() {
        sanitizer = new QuerySanitizer(SanitizerConfig.defaults());
    }

    private static void assertRejected(SanitizationResult result, ViolationType expected) {
        assertFalse(result.safe(), "expected rejection, got warnings " + result.warnings());
        assertEquals(expected, result.violation(), result.error());
        assertNotNull(result.error());
    }

    @Nested
    @DisplayName("Basic checks")
    class BasicChecks {

        @Test
        @DisplayName("Should allow a plain read query without warnings")
        void shouldAllowPlainQuery() {
            SanitizationResult result = sanitizer.sanitize("MATCH (p:Person) WHERE p.name = 'Alice' RETURN p");

            assertTrue(result.safe());
            assertTrue(result.warnings().isEmpty());
            assertNull(result.violation());
            assertTrue(result.violationType().isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\n\t"})
        @DisplayName("Should reject empty queries")
        void shouldRejectEmpty(String query) {
            assertRejected(sanitizer.sanitize(query), ViolationType.EMPTY_QUERY);
        }

        @Test
        @DisplayName("Should reject null query")
        void shouldRejectNull() {
            assertRejected(sanitizer.sanitize(null), ViolationType.EMPTY_QUERY);
        }

        @Test
        @DisplayName("Should reject queries over the configured length")
        void shouldRejectTooLong() {
            QuerySanitizer strict = new QuerySanitizer(SanitizerConfig.builder().maxQueryLength(20).build());

            assertRejected(strict.sanitize("MATCH (n) RETURN n LIMIT 1000"), ViolationType.QUERY_TOO_LONG);
            assertTrue(strict.sanitize("MATCH (n) RETURN n").safe());
        }

        @Test
        @DisplayName("Should fall back to defaults for non-positive limits")
        void shouldFallBackToDefaults() {
            SanitizerConfig config = new SanitizerConfig(false, false, false, false, false, 0, -1, 0);

            assertEquals(SanitizerConfig.DEFAULT_MAX_QUERY_LENGTH, config.maxQueryLength());
            assertEquals(SanitizerConfig.DEFAULT_MAX_PARAMETERS, config.maxParameters());
            assertEquals(SanitizerConfig.DEFAULT_MAX_PARAMETER_LENGTH, config.maxParameterLength());
        }
    }

    @Nested
    @DisplayName("Dangerous pattern rules")
    class DangerousRules {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "fs.load-csv|LOAD CSV FROM 'file:///etc/passwd' AS row RETURN row|FILESYSTEM_ACCESS",
                "fs.apoc-load|CALL apoc.load.json('http://example.com') YIELD value RETURN value|FILESYSTEM_ACCESS",
                "fs.apoc-export|CALL apoc.export.csv.all('out.csv', {})|FILESYSTEM_ACCESS",
                "fs.apoc-import|CALL apoc.import.graphml('in.graphml', {})|FILESYSTEM_ACCESS",
                "fs.apoc-log|CALL apoc.log.info('hello')|FILESYSTEM_ACCESS",
                "code.apoc-cypher|CALL apoc.cypher.run('MATCH (n) RETURN n', {}) YIELD value RETURN value|DYNAMIC_EXECUTION",
                "code.apoc-periodic|CALL apoc.periodic.iterate('MATCH (n) RETURN n', 'SET n.x = 1', {})|DYNAMIC_EXECUTION",
                "code.apoc-do|CALL apoc.do.when(true, 'RETURN 1', 'RETURN 2', {})|DYNAMIC_EXECUTION",
                "admin.dbms-security|CALL dbms.security.listUsers()|ADMIN_PROCEDURE",
                "admin.dbms-cluster|CALL dbms.cluster.overview()|ADMIN_PROCEDURE",
                "admin.dbms-kill|CALL dbms.killQuery('query-1')|ADMIN_PROCEDURE",
                "admin.dbms-config|CALL dbms.setConfigValue('db.logs.query.enabled', 'off')|ADMIN_PROCEDURE",
                "admin.apoc-trigger|CALL apoc.trigger.list()|ADMIN_PROCEDURE",
                "admin.apoc-systemdb|CALL apoc.systemdb.graph()|ADMIN_PROCEDURE",
                "admin.apoc-config|CALL apoc.config.list()|ADMIN_PROCEDURE",
                "chain.separator|MATCH (n) RETURN n; MATCH (m) DETACH DELETE m|STATEMENT_CHAINING",
                "iter.huge-range|UNWIND range(1, 10000000) AS i RETURN i|EXCESSIVE_ITERATION"
        })
        @DisplayName("Should reject each dangerous rule")
        void shouldRejectDangerousRule(String ruleId, String query, ViolationType expected) {
            SanitizationResult result = sanitizer.sanitize(query);

            assertRejected(result, expected);
            assertTrue(result.error().contains("[" + ruleId + "]"), result.error());
        }

        @Test
        @DisplayName("Should cover every dangerous rule with a regression case")
        void shouldHaveUniqueRuleIds() {
            Set<String> ids = new HashSet<>();
            for (PatternRule rule : SanitizerRules.DANGEROUS) {
                assertTrue(rule.group().isDangerous(), rule.id());
                assertTrue(ids.add(rule.id()), "duplicate id " + rule.id());
            }
            for (PatternRule rule : SanitizerRules.SUSPICIOUS) {
                assertFalse(rule.group().isDangerous(), rule.id());
                assertTrue(ids.add(rule.id()), "duplicate id " + rule.id());
            }
            assertEquals(17, SanitizerRules.DANGEROUS.size());
        }

        @Test
        @DisplayName("Should see through backtick-quoted procedure names")
        void shouldSeeThroughBackticks() {
            assertRejected(sanitizer.sanitize("CALL `apoc`.`load`.json('x') YIELD value RETURN value"),
                    ViolationType.FILESYSTEM_ACCESS);
            assertRejected(sanitizer.sanitize("CALL apoc . load . json('x') YIELD value RETURN value"),
                    ViolationType.FILESYSTEM_ACCESS);
        }

        @Test
        @DisplayName("Should match keywords case-insensitively and across newlines")
        void shouldMatchAcrossWhitespace() {
            assertRejected(sanitizer.sanitize("load\n\tcsv FROM 'x' AS row RETURN row"),
                    ViolationType.FILESYSTEM_ACCESS);
        }

        @ParameterizedTest
        @ValueSource(strings = {"\u00A0", "\u2003", "\u202F", "\u3000"})
        @DisplayName("Should treat Unicode spaces between keywords as whitespace")
        void shouldMatchAcrossUnicodeSpaces(String space) {
            assertRejected(sanitizer.sanitize("LOAD" + space + "CSV FROM 'file:///etc/passwd' AS row RETURN row"),
                    ViolationType.FILESYSTEM_ACCESS);

            QuerySanitizer readOnly = new QuerySanitizer(SanitizerConfig.builder().readOnly(true).build());
            assertRejected(readOnly.sanitize("MATCH (n) CREATE" + space + "(m:Evil) RETURN m"),
                    ViolationType.WRITE_OPERATION);
            assertRejected(readOnly.sanitize("MERGE" + space + "(m:Evil {id: 1})"), ViolationType.WRITE_OPERATION);
            assertRejected(readOnly.sanitize("MATCH (n) SET" + space + "n.admin = true"),
                    ViolationType.WRITE_OPERATION);
        }

        @Test
        @DisplayName("Should allow a trailing semicolon and small ranges")
        void shouldAllowHarmlessForms() {
            assertTrue(sanitizer.sanitize("MATCH (n) RETURN n;").safe());
            assertTrue(sanitizer.sanitize("MATCH (n) RETURN n;  \n").safe());
            assertTrue(sanitizer.sanitize("UNWIND range(1, 100) AS i RETURN i").safe());
        }

        @Test
        @DisplayName("Should permit administrative procedures with a warning when configured")
        void shouldPermitAdministrativeWhenConfigured() {
            QuerySanitizer permissive = new QuerySanitizer(
                    SanitizerConfig.builder().allowAdministrativeProcedures(true).build());

            SanitizationResult result = permissive.sanitize("CALL dbms.security.listUsers()");

            assertTrue(result.safe());
            assertEquals(1, result.warnings().size());
            assertTrue(result.warnings().get(0).contains("[admin.dbms-security]"));
        }

        @Test
        @DisplayName("Should block write clauses in read-only mode")
        void shouldBlockWritesInReadOnlyMode() {
            QuerySanitizer readOnly = new QuerySanitizer(SanitizerConfig.builder().readOnly(true).build());

            SanitizationResult result = readOnly.sanitize("MATCH (n) DETACH DELETE n");

            assertRejected(result, ViolationType.WRITE_OPERATION);
            assertTrue(result.error().contains("DETACH DELETE"));
            assertTrue(sanitizer.sanitize("MATCH (n) DETACH DELETE n").safe());
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @ParameterizedTest
        @ValueSource(strings = {
                "MATCH (p:Person {name: $name}) RETURN p",
                "CALL apoc.meta.schema()",
                "LOAD CSV FROM 'file:///etc/passwd' AS row RETURN row"
        })
        @DisplayName("Should return equal results for equal query, parameters and configuration")
        void shouldReturnEqualResults(String query) {
            SanitizationResult first = sanitizer.sanitize(query, Map.of("name", "Alice"));

            for (int i = 0; i < 5; i++) {
                SanitizationResult again = sanitizer.sanitize(query, Map.of("name", "Alice"));
                SanitizationResult fresh = new QuerySanitizer(SanitizerConfig.defaults())
                        .sanitize(query, Map.of("name", "Alice"));

                assertEquals(first, again);
                assertEquals(first, fresh);
                assertEquals(first.warnings(), again.warnings());
            }
        }

        @Test
        @DisplayName("Should not carry warnings over between calls")
        void shouldNotCarryWarningsOver() {
            SanitizationResult warned = sanitizer.sanitize("CALL apoc.meta.schema()");
            SanitizationResult plain = sanitizer.sanitize("MATCH (n) RETURN n");

            assertFalse(warned.warnings().isEmpty());
            assertTrue(plain.warnings().isEmpty());
            assertEquals(warned, sanitizer.sanitize("CALL apoc.meta.schema()"));
        }
    }

    @Nested
    @DisplayName("Literal and comment handling")
    class LiteralsAndComments {

        @ParameterizedTest
        @ValueSource(strings = {
                "MATCH (n) WHERE n.url = 'https://example.com/load' RETURN n",
                "MATCH (n) WHERE n.note = 'LOAD CSV is blocked; CALL dbms.security' RETURN n",
                "MATCH (n) WHERE n.s = '(' RETURN n",
                "MATCH (n) WHERE n.s = \"a; b\" RETURN n",
                "MATCH (n) // CALL dbms.security.listUsers()\nRETURN n",
                "MATCH (n) /* LOAD CSV */ RETURN n",
                "MATCH (n) // don't worry\nRETURN n"
        })
        @DisplayName("Should not flag content inside literals and comments")
        void shouldIgnoreLiteralAndCommentContent(String query) {
            SanitizationResult result = sanitizer.sanitize(query);

            assertTrue(result.safe(), result.error());
        }

        @Test
        @DisplayName("Should reject unterminated literals")
        void shouldRejectUnterminatedLiteral() {
            assertRejected(sanitizer.sanitize("MATCH (n) WHERE n.s = 'abc RETURN n"),
                    ViolationType.UNBALANCED_DELIMITERS);
        }

        @Test
        @DisplayName("Should reject unbalanced delimiters")
        void shouldRejectUnbalanced() {
            assertRejected(sanitizer.sanitize("MATCH (n RETURN n"), ViolationType.UNBALANCED_DELIMITERS);
            assertRejected(sanitizer.sanitize("MATCH (n) RETURN [n}"), ViolationType.UNBALANCED_DELIMITERS);
            assertTrue(QuerySanitizer.delimitersBalanced("MATCH (n {a: [1, 2]}) RETURN n"));
        }
    }

    @Nested
    @DisplayName("Suspicious pattern rules")
    class SuspiciousRules {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "proc.apoc|CALL apoc.meta.schema()",
                "proc.dbms|CALL dbms.components()",
                "schema.create-index|CREATE INDEX person_name FOR (n:Person) ON (n.name)",
                "schema.drop-index|DROP INDEX person_name",
                "schema.create-constraint|CREATE CONSTRAINT person_id FOR (n:Person) REQUIRE n.id IS UNIQUE",
                "schema.drop-constraint|DROP CONSTRAINT person_id",
                "concat.literals|MATCH (n) WHERE n.name = 'a' + 'b' RETURN n"
        })
        @DisplayName("Should warn on each suspicious rule and reject in strict mode")
        void shouldWarnThenRejectInStrictMode(String ruleId, String query) {
            SanitizationResult lenient = sanitizer.sanitize(query);
            assertTrue(lenient.safe(), lenient.error());
            assertTrue(lenient.warnings().stream().anyMatch(w -> w.contains("[" + ruleId + "]")),
                    lenient.warnings().toString());

            QuerySanitizer strict = new QuerySanitizer(SanitizerConfig.builder().strictMode(true).build());
            SanitizationResult rejected = strict.sanitize(query);
            assertRejected(rejected, ViolationType.SUSPICIOUS_PATTERN);
        }

        @Test
        @DisplayName("Should not warn on schema changes when allowed")
        void shouldNotWarnOnAllowedSchemaChanges() {
            QuerySanitizer schema = new QuerySanitizer(SanitizerConfig.builder().allowSchemaChanges(true).build());

            SanitizationResult result = schema.sanitize("CREATE INDEX person_name FOR (n:Person) ON (n.name)");

            assertTrue(result.safe());
            assertTrue(result.warnings().isEmpty());
        }
    }

    @Nested
    @DisplayName("Unicode attacks")
    class UnicodeAttacks {

        @Test
        @DisplayName("Should reject a bidi override anywhere in the query")
        void shouldRejectBidiOverride() {
            assertRejected(sanitizer.sanitize("MATCH (n) WHERE n.name = 'abc\u202Edef' RETURN n"),
                    ViolationType.BIDI_OVERRIDE);
            assertRejected(sanitizer.sanitize("MATCH (n) // hidden \u202E\nRETURN n"),
                    ViolationType.BIDI_OVERRIDE);
            assertRejected(sanitizer.sanitize("\u2066MATCH (n) RETURN n"), ViolationType.BIDI_OVERRIDE);
        }

        @Test
        @DisplayName("Should classify every Unicode finding as an attack")
        void shouldClassifyUnicodeAttacks() {
            SanitizationResult result = sanitizer.sanitize("MATCH (n)\u200B RETURN n");

            assertRejected(result, ViolationType.ZERO_WIDTH_CHARACTER);
            assertTrue(result.violation().isUnicodeAttack());
            assertTrue(result.error().contains("U+200B"));
            assertFalse(ViolationType.STATEMENT_CHAINING.isUnicodeAttack());
        }

        @Test
        @DisplayName("Should reject null bytes and broken encoding")
        void shouldRejectNullAndEncoding() {
            assertRejected(sanitizer.sanitize("MATCH (n)\u0000 RETURN n"), ViolationType.NULL_BYTE);
            assertRejected(sanitizer.sanitize("MATCH (n) RETURN '\uD800'"), ViolationType.INVALID_ENCODING);
        }

        @Test
        @DisplayName("Should reject combining marks, math symbols and fullwidth letters")
        void shouldRejectLookalikeRanges() {
            assertRejected(sanitizer.sanitize("MATCH (n) RETURN 'e\u0301'"), ViolationType.COMBINING_DIACRITIC);
            assertRejected(sanitizer.sanitize("MATCH (n) RETURN '\uD835\uDC00'"), ViolationType.MATH_ALPHANUMERIC);
            assertRejected(sanitizer.sanitize("\uFF2DATCH (n) RETURN n"), ViolationType.HOMOGLYPH);
        }

        @Test
        @DisplayName("Should reject Cyrillic letters mixed into keywords")
        void shouldRejectMixedScriptKeyword() {
            SanitizationResult result = sanitizer.sanitize("M\u0410TCH (n) RETURN n");

            assertRejected(result, ViolationType.HOMOGLYPH);
            assertTrue(result.error().contains("U+0410"));
        }

        @Test
        @DisplayName("Should reject lookalikes used as identifiers")
        void shouldRejectLookalikeIdentifier() {
            assertRejected(sanitizer.sanitize("MATCH (\u0440) RETURN \u0440"), ViolationType.HOMOGLYPH);
        }

        @Test
        @DisplayName("Should allow foreign-script prose inside literals")
        void shouldAllowForeignProse() {
            SanitizationResult result = sanitizer.sanitize(
                    "MATCH (c:City) WHERE c.name = '\u041C\u043E\u0441\u043A\u0432\u0430' RETURN c");

            assertTrue(result.safe(), result.error());
        }

        @Test
        @DisplayName("Should reject a keyword spelled entirely in lookalikes inside a literal")
        void shouldRejectSpoofedKeyword() {
            assertRejected(sanitizer.sanitize("MATCH (n) WHERE n.s = '\u0405\u0415\u0422' RETURN n"),
                    ViolationType.HOMOGLYPH);
        }

        @Test
        @DisplayName("Should reject escape sequences")
        void shouldRejectEscapes() {
            assertRejected(sanitizer.sanitize("MATCH (n) WHERE n.name = '\\x41' RETURN n"),
                    ViolationType.ESCAPE_SEQUENCE);
            assertRejected(sanitizer.sanitize("MATCH (n) WHERE n.name = '\\u0041' RETURN n"),
                    ViolationType.ESCAPE_SEQUENCE);
        }

        @Test
        @DisplayName("Should reject non-ASCII only when configured")
        void shouldRejectNonAsciiWhenConfigured() {
            String query = "MATCH (n) WHERE n.name = 'caf\u00E9' RETURN n";
            QuerySanitizer ascii = new QuerySanitizer(SanitizerConfig.builder().blockNonAscii(true).build());

            assertTrue(sanitizer.sanitize(query).safe());
            assertRejected(ascii.sanitize(query), ViolationType.NON_ASCII);
            assertTrue(ascii.sanitize("MATCH (n) WHERE n.note = 'it\u2019s' RETURN n").safe());
        }
    }

    @Nested
    @DisplayName("Parameter validation")
    class Parameters {

        private static final String QUERY = "MATCH (n) WHERE n.name = $name RETURN n";

        @Test
        @DisplayName("Should accept well-formed parameters")
        void shouldAcceptParameters() {
            SanitizationResult result = sanitizer.sanitize(QUERY,
                    Map.of("name", "Alice", "age", 30, "tags", List.of("a", "b"), "name_2", "Matchbox"));

            assertTrue(result.safe(), result.error());
        }

        @Test
        @DisplayName("Should reject too many parameters")
        void shouldRejectTooMany() {
            QuerySanitizer limited = new QuerySanitizer(SanitizerConfig.builder().maxParameters(2).build());

            assertRejected(limited.sanitize(QUERY, Map.of("a", 1, "b", 2, "c", 3)),
                    ViolationType.TOO_MANY_PARAMETERS);
        }

        @ParameterizedTest
        @ValueSource(strings = {"1name", "a-b", "na me", "$name", ""})
        @DisplayName("Should reject invalid parameter names")
        void shouldRejectInvalidNames(String name) {
            assertRejected(sanitizer.sanitize(QUERY, Map.of(name, "x")), ViolationType.INVALID_PARAMETER_NAME);
        }

        @Test
        @DisplayName("Should reject oversized values and structures")
        void shouldRejectOversized() {
            QuerySanitizer limited = new QuerySanitizer(SanitizerConfig.builder().maxParameterLength(10).build());

            assertRejected(limited.sanitize(QUERY, Map.of("name", "x".repeat(11))),
                    ViolationType.PARAMETER_TOO_LONG);
            assertRejected(limited.sanitize(QUERY, Map.of("names", List.of("aaaa", "bbbb", "cccc"))),
                    ViolationType.PARAMETER_TOO_LONG);
        }

        @Test
        @DisplayName("Should reject injection markers in values")
        void shouldRejectInjection() {
            assertRejected(sanitizer.sanitize(QUERY, Map.of("name", "x'; MATCH (n) DETACH DELETE n")),
                    ViolationType.PARAMETER_INJECTION);
            assertRejected(sanitizer.sanitize(QUERY, Map.of("name", "a -- b")),
                    ViolationType.PARAMETER_INJECTION);
        }

        @Test
        @DisplayName("Should inspect nested collections and maps")
        void shouldInspectNestedValues() {
            assertRejected(sanitizer.sanitize(QUERY, Map.of("filter", Map.of("q", "DROP everything"))),
                    ViolationType.PARAMETER_INJECTION);
            assertRejected(sanitizer.sanitize(QUERY, Map.of("names", List.of("ok", "bad\u202E"))),
                    ViolationType.BIDI_OVERRIDE);
        }
    }
}
