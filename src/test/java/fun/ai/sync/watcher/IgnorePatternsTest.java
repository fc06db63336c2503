package fun.ai.sync.watcher;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IgnorePatterns 单元测试
 */
class IgnorePatternsTest {

    private final IgnorePatterns patterns = IgnorePatterns.defaults();

    @Test
    void testDirectoryNamesMatchAtAnyDepth() {
        assertTrue(patterns.matches("node_modules"));
        assertTrue(patterns.matches("node_modules/react/index.js"));
        assertTrue(patterns.matches("web/node_modules/react/index.js"));
        assertTrue(patterns.matches("pkg/__pycache__/m.cpython-311.pyc"));
        assertFalse(patterns.matches("my_node_modules_notes.md"));
    }

    @Test
    void testSuffixPatterns() {
        assertTrue(patterns.matches("a/b/module.pyc"));
        assertTrue(patterns.matches("notes.txt~"));
        assertTrue(patterns.matches(".main.py.swp"));
        assertTrue(patterns.matches("build/out.tmp"));
        assertFalse(patterns.matches("main.py"));
        assertFalse(patterns.matches("tmp/data.json"));
    }

    @Test
    void testPrefixPattern() {
        assertTrue(patterns.matches("docs/.~lock.report.odt#"));
        assertFalse(patterns.matches("docs/report.odt"));
    }

    @Test
    void testMultiSegmentPatterns() {
        assertTrue(patterns.matches(".git/objects"));
        assertTrue(patterns.matches(".git/objects/ab/cdef"));
        assertTrue(patterns.matches("sub/.git/refs/heads/main"));
        assertTrue(patterns.matches(".git/index.lock"));
        assertFalse(patterns.matches(".git/config"));
        assertFalse(patterns.matches(".git/HEAD"));
    }

    @Test
    void testCustomPatternsAndWindowsSeparators() {
        IgnorePatterns custom = new IgnorePatterns(List.of("dist", "*.log", " ", "/cache/tmp/"));
        assertTrue(custom.matches("dist\\bundle.js"));
        assertTrue(custom.matches("logs/app.log"));
        assertTrue(custom.matches("x/cache/tmp/y"));
        assertFalse(custom.matches("cache/y"));
        assertEquals(3, custom.getPatterns().size());
    }

    @Test
    void testHidden() {
        assertTrue(IgnorePatterns.isHidden(".env"));
        assertTrue(IgnorePatterns.isHidden("a/.cache/b.txt"));
        assertFalse(IgnorePatterns.isHidden("a/b.txt"));
        assertFalse(IgnorePatterns.isHidden(""));
    }

    @Test
    void testExcludesCombinesHiddenAndPatterns() {
        IgnorePatterns p = IgnorePatterns.defaults();
        assertTrue(p.excludes(".env"));
        assertTrue(p.excludes(".git/HEAD"));
        assertTrue(p.excludes("node_modules/react/index.js"));
        assertTrue(p.excludes("pkg/mod.pyc"));
        assertFalse(p.excludes("src/main.py"));
        assertFalse(p.excludes("lib"));
    }
}
