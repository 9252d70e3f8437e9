package ai.repld.repl.jshell;

import static org.junit.jupiter.api.Assertions.*;

import ai.repld.repl.KeepFirstErrorMessageCollector;
import ai.repld.repl.MessageCollector;
import ai.repld.repl.ReplCheckResult;
import ai.repld.repl.ReplCodeLine;
import ai.repld.repl.ReplCompileResult;
import ai.repld.repl.ReplCompilerConfiguration;
import ai.repld.repl.ReplService;
import ai.repld.repl.ReplStageState;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class JShellReplCompilerTest {

    private final List<ReplStageState> states = new ArrayList<>();

    @AfterEach
    void tearDown() {
        states.forEach(ReplStageState::dispose);
    }

    private static JShellReplCompiler newCompiler(MessageCollector collector) {
        return new JShellReplCompiler(
                "",
                List.of(),
                JShellReplCompilerTest.class.getClassLoader(),
                new ReplCompilerConfiguration(ReplCompilerConfiguration.DEFAULT_MODULE_NAME, List.of(), collector));
    }

    private ReplStageState newState(JShellReplCompiler compiler) {
        var state = compiler.createState();
        states.add(state);
        return state;
    }

    private static CompiledSnippet compiled(ReplCompileResult result) {
        var classes = assertInstanceOf(ReplCompileResult.CompiledClasses.class, result, () -> result.toString());
        return assertInstanceOf(CompiledSnippet.class, classes.artifact());
    }

    @Test
    void testCheckCompleteAndIncomplete() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);

        assertInstanceOf(ReplCheckResult.Ok.class, compiler.check(state, ReplCodeLine.of(1, "int x = 1;")));
        assertInstanceOf(ReplCheckResult.Ok.class, compiler.check(state, ReplCodeLine.of(1, "x + 1")));
        assertInstanceOf(ReplCheckResult.Incomplete.class, compiler.check(state, ReplCodeLine.of(1, "int x =")));
        assertInstanceOf(ReplCheckResult.Incomplete.class, compiler.check(state, ReplCodeLine.of(1, "void f() {")));
        assertEquals(new ReplCheckResult.Error("Empty code line"), compiler.check(state, ReplCodeLine.of(1, "   ")));
        assertEquals(0, state.getCurrentGeneration());
    }

    @Test
    void testCompileScenario() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);

        var declared = compiler.compile(state, ReplCodeLine.of(1, "int x = 1;"));
        var snippet = compiled(declared);
        assertEquals("x", snippet.name());
        assertEquals("1", snippet.value());
        assertEquals(1, ((ReplCompileResult.CompiledClasses) declared).generation());

        assertInstanceOf(ReplCompileResult.Incomplete.class, compiler.compile(state, ReplCodeLine.of(2, "int y =")));
        assertEquals(1, state.getCurrentGeneration());

        var sum = compiled(compiler.compile(state, ReplCodeLine.of(2, "x + 1")));
        assertEquals("2", sum.value());
        assertNull(sum.exception());
        assertEquals(2, state.getCurrentGeneration());
        assertEquals(List.of("int x = 1;", "x + 1"), state.getHistory().stream().map(ReplCodeLine::code).toList());
    }

    @Test
    void testRejectedLineLeavesStateUnchanged() {
        var collector = new KeepFirstErrorMessageCollector(MessageCollector.NONE);
        var compiler = newCompiler(collector);
        var state = newState(compiler);
        compiler.compile(state, ReplCodeLine.of(1, "int x = 1;"));

        var result = compiler.compile(state, ReplCodeLine.of(2, "undefinedName + 1"));

        var error = assertInstanceOf(ReplCompileResult.Error.class, result);
        assertTrue(error.message().contains("cannot find symbol"), error.message());
        assertNotNull(error.location());
        assertEquals(2, error.location().line());
        assertEquals(1, error.location().column());
        assertEquals(1, state.getCurrentGeneration());
        assertTrue(collector.firstErrorMessage().contains("cannot find symbol"));
    }

    @Test
    void testEachCallReportsItsOwnFirstError() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);

        var first = (ReplCompileResult.Error) compiler.compile(state, ReplCodeLine.of(1, "int a = \"text\";"));
        var second = (ReplCompileResult.Error) compiler.compile(state, ReplCodeLine.of(2, "missing()"));

        assertTrue(first.message().contains("incompatible types"), first.message());
        assertTrue(second.message().contains("cannot find symbol"), second.message());
    }

    @Test
    void testSeveralSnippetsOnOneLineAreRejected() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);

        var result = compiler.compile(state, ReplCodeLine.of(1, "int a = 1; int b = 2;"));

        assertEquals(new ReplCompileResult.Error("Only one declaration or statement per line is supported"), result);
        assertEquals(0, state.getCurrentGeneration());
    }

    @Test
    void testCheckRejectsSeveralSnippetsLikeCompile() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);
        var line = ReplCodeLine.of(1, "int a = 1; int b = 2;");

        var check = compiler.check(state, line);
        var compile = compiler.compile(state, line);

        assertEquals(new ReplCheckResult.Error("Only one declaration or statement per line is supported"), check);
        assertEquals(new ReplCompileResult.Error("Only one declaration or statement per line is supported"), compile);
        assertInstanceOf(
                ReplCheckResult.Error.class, compiler.check(state, ReplCodeLine.of(1, "int a = 1; int b =")));
    }

    @Test
    void testFailedClassRedefinitionKeepsPreviousClass() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);
        compiled(compiler.compile(state, ReplCodeLine.of(1, "class A { int v() { return 7; } }")));

        var failed = compiler.compile(state, ReplCodeLine.of(2, "class A extends Missing { }"));

        assertInstanceOf(ReplCompileResult.Error.class, failed);
        assertEquals(1, state.getCurrentGeneration());
        assertEquals("7", compiled(compiler.compile(state, ReplCodeLine.of(2, "new A().v()"))).value());
        assertEquals(2, state.getCurrentGeneration());
    }

    @Test
    void testFailedVariableRedefinitionKeepsPreviousVariable() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);
        compiled(compiler.compile(state, ReplCodeLine.of(1, "int x = 1;")));

        var failed = compiler.compile(state, ReplCodeLine.of(2, "String x = nope();"));

        assertInstanceOf(ReplCompileResult.Error.class, failed);
        assertEquals(1, state.getCurrentGeneration());
        assertEquals("2", compiled(compiler.compile(state, ReplCodeLine.of(2, "x + 1"))).value());
    }

    @Test
    void testFailedRedefinitionKeepsDependentMethodsWorking() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);
        compiled(compiler.compile(state, ReplCodeLine.of(1, "class A { int v() { return 7; } }")));
        compiled(compiler.compile(state, ReplCodeLine.of(2, "int useA() { return new A().v() + 1; }")));

        assertInstanceOf(
                ReplCompileResult.Error.class,
                compiler.compile(state, ReplCodeLine.of(3, "class A extends Missing { }")));

        assertEquals("8", compiled(compiler.compile(state, ReplCodeLine.of(3, "useA()"))).value());
    }

    @Test
    void testRuntimeExceptionStillCompiles() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);

        var snippet = compiled(compiler.compile(state, ReplCodeLine.of(1, "Integer.parseInt(\"nope\")")));

        assertNotNull(snippet.exception());
        assertTrue(snippet.exception().contains("NumberFormatException"), snippet.exception());
        assertEquals(1, state.getCurrentGeneration());
    }

    @Test
    void testSessionsDoNotShareDeclarations() {
        var compiler = newCompiler(MessageCollector.NONE);
        var a = newState(compiler);
        var b = newState(compiler);

        compiled(compiler.compile(a, ReplCodeLine.of(1, "int x = 1;")));
        var result = compiler.compile(b, ReplCodeLine.of(1, "x + 1"));

        assertInstanceOf(ReplCompileResult.Error.class, result);
        assertEquals(1, a.getCurrentGeneration());
        assertEquals(0, b.getCurrentGeneration());
    }

    @Test
    void testMethodDeclaration() {
        var compiler = newCompiler(MessageCollector.NONE);
        var state = newState(compiler);

        var method = compiled(compiler.compile(state, ReplCodeLine.of(1, "int twice(int n) { return n * 2; }")));
        assertEquals("METHOD", method.kind());
        assertEquals("twice", method.name());

        assertEquals("10", compiled(compiler.compile(state, ReplCodeLine.of(2, "twice(5)"))).value());
    }

    @Test
    void testTemplateMembersAreImported() throws Exception {
        var fixtureRoot = Path.of(
                ReplTemplateFixture.class.getProtectionDomain().getCodeSource().getLocation().toURI());
        var compiler = new JShellReplCompiler(
                ReplTemplateFixture.class.getName(),
                List.of(fixtureRoot),
                JShellReplCompilerTest.class.getClassLoader(),
                new ReplCompilerConfiguration(
                        ReplCompilerConfiguration.DEFAULT_MODULE_NAME, List.of(fixtureRoot), MessageCollector.NONE));
        var state = newState(compiler);

        assertEquals("42", compiled(compiler.compile(state, ReplCodeLine.of(1, "ANSWER"))).value());
        assertEquals(
                "\"Hello, repl\"", compiled(compiler.compile(state, ReplCodeLine.of(2, "greet(\"repl\")"))).value());
    }

    @Test
    void testUnknownTemplateFailsFast() {
        var ex = assertThrows(IllegalStateException.class, () -> new JShellReplCompiler(
                "com.example.NoSuchTemplate",
                List.of(),
                JShellReplCompilerTest.class.getClassLoader(),
                new ReplCompilerConfiguration(
                        ReplCompilerConfiguration.DEFAULT_MODULE_NAME, List.of(), MessageCollector.NONE)));
        assertTrue(ex.getMessage().contains("com.example.NoSuchTemplate"));
    }

    @Test
    void testConcurrentCompilesAgainstOneSessionAreSerialized() throws Exception {
        var compiler = newCompiler(MessageCollector.NONE);
        try (var service = new ReplService(0, compiler, null)) {
            int id = service.createRemoteState().getId();
            int lines = 12;
            var pool = Executors.newFixedThreadPool(4);
            try {
                var futures = new ArrayList<Future<ReplCompileResult>>();
                for (int i = 1; i <= lines; i++) {
                    var line = ReplCodeLine.of(i, "int v" + i + " = " + i + ";");
                    Callable<ReplCompileResult> task = () -> service.compile(id, line).get();
                    futures.add(pool.submit(task));
                }
                var generations = new HashSet<Integer>();
                for (var future : futures) {
                    var result = future.get(60, TimeUnit.SECONDS);
                    var classes = assertInstanceOf(ReplCompileResult.CompiledClasses.class, result);
                    generations.add(classes.generation());
                }
                assertEquals(lines, generations.size());
                var state = service.getStates().find(id).orElseThrow().getState();
                assertEquals(lines, state.getCurrentGeneration());
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
