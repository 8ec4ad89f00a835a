package com.dcgraph.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.dcgraph.index.GraphIndex;
import com.dcgraph.lex.LexException;

class CallSiteExtractorTest {

    private final CallSiteExtractor extractor = new CallSiteExtractor(ExtractionPolicy.defaults());

    @Test
    void shouldBuildCallAndDependencyMapsForMutualRecursion() throws Exception {
        GraphIndex index = extract("""
                proc A {} {
                    B
                    C
                }
                proc B {} {
                    A
                }
                """);

        assertEquals(Map.of("A", List.of("B", "C"), "B", List.of("A")), index.callMap());
        assertEquals(Map.of("B", List.of("A"), "C", List.of("A"), "A", List.of("B")), index.dependencyMap());
    }

    @Test
    void shouldScanNestedControlFlowBlocksAsPartOfTheBody() throws Exception {
        GraphIndex index = extract("""
                proc process {items} {
                    foreach item $items {
                        if {[validate $item]} {
                            handle $item
                        } else {
                            reject $item; log_failure $item
                        }
                    }
                    finish
                }
                proc after_body {} { tail }
                """);

        assertEquals(List.of("foreach", "if", "validate", "handle", "reject", "log_failure", "finish"),
                index.calleesOf("process"));
        assertEquals(List.of("tail"), index.calleesOf("after_body"));
        assertFalse(index.calleesOf("process").contains("else"));
    }

    @Test
    void shouldRecordDuplicatesAndSelfRecursionInDiscoveryOrder() throws Exception {
        GraphIndex index = extract("""
                proc fact {n} {
                    if {$n <= 1} { return 1 }
                    expr {$n * [fact [expr {$n - 1}]]}
                    fact 0
                }
                """);

        assertEquals(List.of("if", "return", "expr", "fact", "expr", "fact"), index.calleesOf("fact"));
        assertEquals(List.of("fact", "fact"), index.callersOf("fact"));
    }

    @Test
    void shouldIgnoreCommentsAndTopLevelCommands() throws Exception {
        GraphIndex index = extract("""
                # proc commented {} { nothing }
                setup_globals
                proc worker {} {
                    # helper is not called here
                    real_call ;# trailing comment
                }
                worker
                """);

        assertEquals(Set.of("worker"), index.procedureNames());
        assertEquals(List.of("real_call"), index.calleesOf("worker"));
        assertFalse(index.hasDependencyInfo("setup_globals"));
        assertFalse(index.hasDependencyInfo("helper"));
    }

    @Test
    void shouldRegisterProcedureWithEmptyBody() throws Exception {
        GraphIndex index = extract("proc noop {} {}\nproc caller {} { noop; missing }\n");

        assertTrue(index.contains("noop"));
        assertEquals(List.of(), index.calleesOf("noop"));
        assertFalse(index.contains("missing"));
        assertTrue(index.hasDependencyInfo("missing"));
        assertEquals(List.of("caller"), index.callersOf("missing"));
    }

    @Test
    void shouldFindProceduresInsideNamespaceBlocks() throws Exception {
        GraphIndex index = extract("""
                namespace eval util {
                    proc ::util::join_all {args} {
                        join $args
                    }
                    proc {braced} args { puts hi }
                }
                """);

        assertEquals(List.of("join"), index.calleesOf("::util::join_all"));
        assertEquals(List.of("puts"), index.calleesOf("braced"));
    }

    @Test
    void shouldRecordSubstitutionsInsideQuotes() throws Exception {
        GraphIndex index = extract("""
                proc report {} {
                    puts "total: [count_items] at [clock seconds] \\[escaped]"
                }
                """);

        assertEquals(List.of("puts", "count_items", "clock"), index.calleesOf("report"));
    }

    @Test
    void shouldSkipVariableCommandsAndNumbers() throws Exception {
        GraphIndex index = extract("""
                proc dispatch {handler} {
                    $handler run
                    if {1} { 42 }
                    ${handler}_done
                }
                """);

        assertEquals(List.of("if"), index.calleesOf("dispatch"));
    }

    @Test
    void shouldHonourExcludedCommands() throws Exception {
        CallSiteExtractor filtered = new CallSiteExtractor(
                new ExtractionPolicy(Set.of("if", "set"), true, ExtractionPolicy.DEFAULT_SCRIPT_COMMANDS));

        GraphIndex index = filtered.extract("proc p {} {\n set x 1\n if {$x} { work }\n}\n").build();

        assertEquals(List.of("work"), index.calleesOf("p"));
    }

    @Test
    void shouldIgnoreMalformedProcDefinitions() throws Exception {
        GraphIndex index = extract("""
                proc
                proc onlyname
                proc quoted {} "body in quotes"
                proc ok {} { fine }
                """);

        assertEquals(Set.of("ok"), index.procedureNames());
        assertEquals(List.of("fine"), index.calleesOf("ok"));
    }

    @Test
    void shouldNotTreatBracesInArgumentDefaultsAsBody() throws Exception {
        GraphIndex index = extract("proc opt {{a {x y}} b} {\n  use $a\n}\n");

        assertEquals(List.of("use"), index.calleesOf("opt"));
    }

    @Test
    void shouldIgnoreWordsInsideDataBraces() throws Exception {
        GraphIndex index = extract("""
                proc p {s} { set colors {red green}; regexp {^[0-9]+$} $s; while {true} { step }; {*}$cmd arg }
                """);

        assertEquals(List.of("set", "regexp", "while", "step"), index.calleesOf("p"));
        assertFalse(index.hasDependencyInfo("red"));
        assertFalse(index.hasDependencyInfo("true"));
        assertFalse(index.hasDependencyInfo("*"));
    }

    @Test
    void shouldNotScanBracesOfCommandsThatTakeNoScript() throws Exception {
        GraphIndex index = extract("""
                proc schedule {} {
                    after 100 { later }
                    list {first second}
                    proc inner {} { nested_call }
                    lappend queue {a b}
                }
                """);

        assertEquals(List.of("after", "list", "proc", "lappend"), index.calleesOf("schedule"));
        assertFalse(index.contains("inner"));
    }

    @Test
    void shouldFollowScriptArgumentsOfLoopsAndExceptionHandlers() throws Exception {
        GraphIndex index = extract("""
                proc loops {items} {
                    for {set i 0} {$i < [count]} {incr i} { body_step }
                    foreach {k v} $items { visit $k }
                    catch { risky } err
                    try { attempt } on error {msg opts} { recover } finally { release }
                    dict for {key value} $items { per_entry }
                }
                """);

        assertEquals(List.of("for", "set", "count", "incr", "body_step", "foreach", "visit", "catch", "risky",
                "try", "attempt", "recover", "release", "dict", "per_entry"), index.calleesOf("loops"));
    }

    @Test
    void shouldScanOnlySwitchBodiesNotPatterns() throws Exception {
        GraphIndex index = extract("""
                proc route {cmd} {
                    switch -exact -- $cmd {
                        start { do_start }
                        stop -
                        halt { do_stop; cleanup }
                        default { unknown_command $cmd }
                    }
                    switch -glob $cmd {a*} { glob_branch } {b*} { other_branch }
                }
                """);

        assertEquals(List.of("switch", "do_start", "do_stop", "cleanup", "unknown_command", "switch", "glob_branch",
                "other_branch"), index.calleesOf("route"));
    }

    @Test
    void shouldRecordCommandSubstitutionsInExpressionsOnly() throws Exception {
        GraphIndex index = extract("""
                proc check {x} {
                    if {$x > [limit] && [ready]} { go } elseif {[fallback_ok]} { fallback } else { stop }
                    set pattern {[not_a_call]}
                }
                """);

        assertEquals(List.of("if", "limit", "ready", "go", "fallback_ok", "fallback", "stop", "set"),
                index.calleesOf("check"));
    }

    @Test
    void shouldScanBracesOfConfiguredScriptCommands() throws Exception {
        String source = "proc guarded {m} {\n    with_lock $m { critical }\n}\n";
        Set<String> scripts = Set.of("with_lock");
        CallSiteExtractor custom = new CallSiteExtractor(new ExtractionPolicy(Set.of(), true, scripts));

        assertEquals(List.of("with_lock", "critical"), custom.extract(source).build().calleesOf("guarded"));
        assertEquals(List.of("with_lock"), extract(source).calleesOf("guarded"));
    }

    @Test
    void shouldTreatQuotesInsideBracesAsPlainCharacters() throws Exception {
        GraphIndex index = extract("""
                proc p {s} {
                    set q {"}
                    regsub -all {"} $s {\\"} out
                    work
                }
                proc other {} { more }
                """);

        assertEquals(List.of("set", "regsub", "work"), index.calleesOf("p"));
        assertEquals(List.of("more"), index.calleesOf("other"));
    }

    @Test
    void shouldProduceNothingForFileWithoutProcedures() throws Exception {
        assertTrue(extractor.extract("set x 1\nputs $x\n").isEmpty());
    }

    @Test
    void shouldPropagateLexErrors() {
        assertThrows(LexException.class, () -> extractor.extract("proc broken {} {\n  call\n"));
    }

    private GraphIndex extract(String source) throws LexException {
        return extractor.extract(source).build();
    }
}
