package com.nodeflow.scriptlet;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AwaitRewriterTest {

    @Test
    void rewrite_wrapsOperandWithItsMemberChain() {
        assertEquals("const r = ((yield fetchIt(data).then(x => x))).body;",
                AwaitRewriter.rewrite("const r = (await fetchIt(data).then(x => x)).body;"));
        assertEquals("return (yield a) + (yield b);", AwaitRewriter.rewrite("return await a + await b;"));
    }

    @Test
    void rewrite_handlesNestedAndPrefixedOperands() {
        assertEquals("return (yield (yield p));", AwaitRewriter.rewrite("return await await p;"));
        assertEquals("if ((yield !ok)) {}", AwaitRewriter.rewrite("if (await !ok) {}"));
        assertEquals("x = (yield new Promise(f));", AwaitRewriter.rewrite("x = await new Promise(f);"));
    }

    @Test
    void rewrite_leavesStringsCommentsAndPropertyNamesAlone() {
        String body = "// await here\n"
                + "const s = 'await me' + \"await\" + `await ${1}`;\n"
                + "const o = { await: 1 }; /* await */\n"
                + "return o.await + awaited;";

        assertEquals(body, AwaitRewriter.rewrite(body));
    }

    @Test
    void rewrite_keepsLineBreakAfterOperand() {
        assertEquals("return (yield value)\n;", AwaitRewriter.rewrite("return await\nvalue;"));
    }

    @Test
    void rewrite_insideNestedBlocks() {
        assertEquals("for (const p of ps) { out.push((yield p)); }",
                AwaitRewriter.rewrite("for (const p of ps) { out.push(await p); }"));
    }
}
