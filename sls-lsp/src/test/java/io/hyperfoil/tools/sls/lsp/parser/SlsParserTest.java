package io.hyperfoil.tools.sls.lsp.parser;

import io.hyperfoil.tools.sls.lsp.ast.AstNode;
import io.hyperfoil.tools.sls.lsp.ast.ExtendNode;
import io.hyperfoil.tools.sls.lsp.ast.IncludesNode;
import io.hyperfoil.tools.sls.lsp.ast.Position;
import io.hyperfoil.tools.sls.lsp.ast.RequisiteNode;
import io.hyperfoil.tools.sls.lsp.ast.RequisitesNode;
import io.hyperfoil.tools.sls.lsp.ast.StateCallNode;
import io.hyperfoil.tools.sls.lsp.ast.StateNode;
import io.hyperfoil.tools.sls.lsp.ast.StateParameterNode;
import io.hyperfoil.tools.sls.lsp.ast.TokenNode;
import io.hyperfoil.tools.sls.lsp.ast.Tree;
import org.junit.Test;
import org.yaml.snakeyaml.tokens.Token;

import java.util.List;

import static io.hyperfoil.tools.sls.lsp.ast.AstAssert.assertSpan;
import static io.hyperfoil.tools.sls.lsp.ast.AstAssert.pos;
import static org.junit.Assert.*;

public class SlsParserTest {

    private static final String TWO_PARAMS = String.join("\n",
            "/etc/systemd/system/rootco-salt-backup.service:",
            "  file.managed:",
            "    - user: root",
            "    - group: root",
            ""
    );

    @Test
    public void testIncludes() {
        Tree tree = SlsParser.parse(String.join("\n",
                "include:",
                "  - foo.bar",
                "  - web",
                ""
        ));

        assertSpan("tree", tree, 0, 0, 3, 0);
        assertTrue("include is not a state", tree.getStates().isEmpty());
        IncludesNode includes = tree.getIncludes();
        assertSpan("includes", includes, 0, 0, 3, 0);
        assertEquals(2, includes.getIncludes().size());
        assertSpan("foo.bar", includes.getIncludes().get(0), 1, 2, 1, 11);
        assertEquals("foo.bar", includes.getIncludes().get(0).getValue());
        assertSpan("web", includes.getIncludes().get(1), 2, 2, 2, 7);
        assertEquals("web", includes.getIncludes().get(1).getValue());
        assertSame("include parent", includes, includes.getIncludes().get(0).getParent());
        assertSame("includes parent", tree, includes.getParent());
    }

    @Test
    public void testSimpleState() {
        Tree tree = SlsParser.parse(TWO_PARAMS);

        assertSpan("tree", tree, 0, 0, 4, 0);
        assertEquals(1, tree.getStates().size());
        StateNode state = tree.getStates().get(0);
        assertEquals("/etc/systemd/system/rootco-salt-backup.service", state.getIdentifier());
        assertSpan("state", state, 0, 0, 4, 0);

        StateCallNode call = state.getStates().get(0);
        assertEquals("file.managed", call.getName());
        assertSpan("call", call, 1, 2, 4, 0);
        assertTrue(call.getRequisites().isEmpty());

        List<StateParameterNode> params = call.getParameters();
        assertEquals(2, params.size());
        assertEquals("user", params.get(0).getName());
        assertEquals("root", params.get(0).getValue());
        assertSpan("user", params.get(0), 2, 4, 3, 4);
        assertEquals("group", params.get(1).getName());
        assertEquals("root", params.get(1).getValue());
        assertSpan("group", params.get(1), 3, 4, 4, 0);
        assertSame(call, params.get(1).getParent());
    }

    @Test
    public void testExtend() {
        Tree tree = SlsParser.parse(String.join("\n",
                "extend:",
                "  /etc/systemd/system/rootco-salt-backup.service:",
                "    file.managed:",
                "      - user: root",
                "      - group: root",
                ""
        ));

        assertSpan("tree", tree, 0, 0, 5, 0);
        assertTrue("extend is not a state", tree.getStates().isEmpty());
        ExtendNode extend = tree.getExtend();
        assertSpan("extend", extend, 0, 0, 5, 0);
        StateNode state = extend.getStates().get(0);
        assertEquals("/etc/systemd/system/rootco-salt-backup.service", state.getIdentifier());
        assertSpan("state", state, 1, 2, 5, 0);
        StateCallNode call = state.getStates().get(0);
        assertSpan("call", call, 2, 4, 5, 0);
        assertSpan("user", call.getParameters().get(0), 3, 6, 4, 6);
        assertSpan("group", call.getParameters().get(1), 4, 6, 5, 0);
    }

    @Test
    public void testRequisites() {
        Tree tree = SlsParser.parse(String.join("\n",
                "/etc/systemd/system/rootco-salt-backup.service:",
                "  file.managed:",
                "    - user: root",
                "    - group: root",
                "    - require:",
                "      - file: /foo/bar",
                "      - service: libvirtd",
                ""
        ));

        StateCallNode call = tree.getStates().get(0).getStates().get(0);
        assertSpan("call", call, 1, 2, 7, 0);
        assertEquals("require must not stay a parameter", 2, call.getParameters().size());
        assertSpan("group", call.getParameters().get(1), 3, 4, 4, 4);

        assertEquals(1, call.getRequisites().size());
        RequisitesNode require = call.getRequisites().get(0);
        assertEquals("require", require.getKind());
        assertSpan("require", require, 4, 4, 7, 0);
        assertSame(call, require.getParent());

        RequisiteNode file = require.getRequisites().get(0);
        assertEquals("file", file.getModule());
        assertEquals("/foo/bar", file.getReference());
        assertSpan("file requisite", file, 5, 6, 6, 6);
        RequisiteNode service = require.getRequisites().get(1);
        assertEquals("service", service.getModule());
        assertEquals("libvirtd", service.getReference());
        assertSpan("service requisite", service, 6, 6, 7, 0);
    }

    @Test
    public void testRequisiteVariants() {
        Tree tree = SlsParser.parse(String.join("\n",
                "app:",
                "  pkg.installed:",
                "    - watch_in:",
                "      - service: app",
                "    - onchanges_any:",
                "      - file: /etc/app.conf",
                "    - refresh: true",
                ""
        ));

        StateCallNode call = tree.getStates().get(0).getStates().get(0);
        assertEquals(2, call.getRequisites().size());
        assertEquals("watch_in", call.getRequisites().get(0).getKind());
        assertEquals("onchanges_any", call.getRequisites().get(1).getKind());
        assertEquals(1, call.getParameters().size());
        assertEquals("refresh", call.getParameters().get(0).getName());
        assertEquals("requisites follow parameters in the children",
                call.getRequisites().get(0), call.getChildren().get(1));
    }

    @Test
    public void testComplexParameter() {
        Tree tree = SlsParser.parse(String.join("\n",
                "saltmaster.packages:",
                "  pkg.installed:",
                "    - pkgs:",
                "      - salt-master",
                "      - sshd",
                "      - git",
                ""
        ));

        StateCallNode call = tree.getStates().get(0).getStates().get(0);
        assertSpan("call", call, 1, 2, 6, 0);
        StateParameterNode pkgs = call.getParameters().get(0);
        assertEquals("pkgs", pkgs.getName());
        assertSpan("pkgs", pkgs, 2, 4, 6, 0);
        assertTrue("list value is kept as tokens", pkgs.isComplexValue());
        assertNull(pkgs.getValue());

        List<TokenNode> tokens = pkgs.getTokens();
        assertEquals(6, tokens.size());
        String[] names = {"salt-master", "sshd", "git"};
        for (int i = 0; i < names.length; i++) {
            assertEquals(Token.ID.BlockEntry, tokens.get(2 * i).getTokenId());
            assertEquals(Token.ID.Scalar, tokens.get(2 * i + 1).getTokenId());
            assertEquals(names[i], tokens.get(2 * i + 1).getValue());
            assertSame(pkgs, tokens.get(2 * i).getParent());
        }
        assertEquals(pos(3, 6), tokens.get(0).getStart());
    }

    @Test
    public void testNestedMappingParameterKeepsBalancedTokens() {
        Tree tree = SlsParser.parse(String.join("\n",
                "app:",
                "  file.managed:",
                "    - context:",
                "        port: 8080",
                "        hosts:",
                "          - a",
                "    - mode: 644",
                ""
        ));

        List<StateParameterNode> params = tree.getStates().get(0).getStates().get(0).getParameters();
        assertEquals(2, params.size());
        StateParameterNode context = params.get(0);
        assertSpan("context", context, 2, 4, 6, 4);
        long starts = context.getTokens().stream().filter(t -> t.getTokenId() == Token.ID.BlockMappingStart
                || t.getTokenId() == Token.ID.BlockSequenceStart).count();
        long ends = context.getTokens().stream().filter(t -> t.getTokenId() == Token.ID.BlockEnd).count();
        assertEquals("every nested start has its end", starts, ends);
        assertEquals("mode", params.get(1).getName());
        assertEquals("644", params.get(1).getValue());
    }

    @Test
    public void testFlowParameterValue() {
        Tree tree = SlsParser.parse(String.join("\n",
                "app:",
                "  pkg.installed:",
                "    - pkgs: [vim, git]",
                "    - refresh: true",
                ""
        ));

        List<StateParameterNode> params = tree.getStates().get(0).getStates().get(0).getParameters();
        assertEquals(2, params.size());
        StateParameterNode pkgs = params.get(0);
        assertEquals(Token.ID.FlowSequenceStart, pkgs.getTokens().get(0).getTokenId());
        assertEquals(Token.ID.FlowSequenceEnd, pkgs.getTokens().get(pkgs.getTokens().size() - 1).getTokenId());
        assertSpan("pkgs", pkgs, 2, 4, 3, 4);
        assertEquals("true", params.get(1).getValue());
    }

    @Test
    public void testDuplicateKey() {
        Tree tree = SlsParser.parse(String.join("\n",
                "/etc/systemd/system/rootco-salt-backup.service:",
                "  file.managed:",
                "    - user: root",
                "    - user: bar",
                ""
        ));

        List<StateParameterNode> params = tree.getStates().get(0).getStates().get(0).getParameters();
        assertEquals("duplicates are both kept", 2, params.size());
        assertEquals("root", params.get(0).getValue());
        assertEquals("bar", params.get(1).getValue());
        assertSpan("second user", params.get(1), 3, 4, 4, 0);
    }

    @Test
    public void testEmptyRequisiteItem() {
        Tree tree = SlsParser.parse(String.join("\n",
                "/etc/systemd/system/rootco-salt-backup.service:",
                "  file.managed:",
                "    - user: root",
                "    - group: root",
                "    - require:",
                "      - file: /foo/bar",
                "      - ",
                "",
                "git -C /srv/salt pull -q:",
                "  cron.present:",
                "    - user: root",
                ""
        ));

        assertSpan("tree", tree, 0, 0, 11, 0);
        assertEquals(2, tree.getStates().size());
        StateNode first = tree.getStates().get(0);
        assertSpan("first state", first, 0, 0, 8, 0);
        RequisitesNode require = first.getStates().get(0).getRequisites().get(0);
        assertSpan("require", require, 4, 4, 8, 0);
        RequisiteNode empty = require.getRequisites().get(1);
        assertSpan("empty requisite", empty, 6, 6, 8, 0);
        assertNull(empty.getModule());
        assertNull(empty.getReference());

        StateNode second = tree.getStates().get(1);
        assertEquals("git -C /srv/salt pull -q", second.getIdentifier());
        assertSpan("second state", second, 8, 0, 11, 0);
        assertSpan("cron user", second.getStates().get(0).getParameters().get(0), 10, 4, 11, 0);
    }

    @Test
    public void testEmptyParameter() {
        Tree tree = SlsParser.parse(String.join("\n",
                "/srv/git/salt-states:",
                "  file.symlink:",
                "    -",
                "    - target: /srv/salt",
                ""
        ));

        List<StateParameterNode> params = tree.getStates().get(0).getStates().get(0).getParameters();
        assertEquals(2, params.size());
        assertSpan("empty", params.get(0), 2, 4, 3, 4);
        assertNull(params.get(0).getName());
        assertFalse(params.get(0).hasValue());
        assertSpan("target", params.get(1), 3, 4, 4, 0);
        assertEquals("/srv/salt", params.get(1).getValue());
    }

    @Test
    public void testEmptyLastParameter() {
        Tree tree = SlsParser.parse(String.join("\n",
                "/srv/git/salt-states:",
                "  file.symlink:",
                "    - target: /srv/salt",
                "    -",
                ""
        ));

        List<StateParameterNode> params = tree.getStates().get(0).getStates().get(0).getParameters();
        assertEquals(2, params.size());
        assertSpan("target", params.get(0), 2, 4, 3, 4);
        assertSpan("empty", params.get(1), 3, 4, 4, 0);
        assertNull(params.get(1).getName());
    }

    @Test
    public void testTopFile() {
        Tree tree = SlsParser.parse(String.join("\n",
                "base:",
                "  '*':",
                "    - common",
                "    - ca",
                ""
        ));

        StateNode base = tree.getStates().get(0);
        assertEquals("base", base.getIdentifier());
        assertSpan("base", base, 0, 0, 4, 0);
        StateCallNode star = base.getStates().get(0);
        assertEquals("*", star.getName());
        assertSpan("star", star, 1, 2, 4, 0);
        assertEquals("common", star.getParameters().get(0).getName());
        assertNull(star.getParameters().get(0).getValue());
        assertSpan("common", star.getParameters().get(0), 2, 4, 3, 4);
        assertEquals("ca", star.getParameters().get(1).getName());
        assertSpan("ca", star.getParameters().get(1), 3, 4, 4, 0);
    }

    @Test
    public void testStateWithoutParameters() {
        Tree tree = SlsParser.parse("jdoe:\n  user.present\n");

        assertSpan("tree", tree, 0, 0, 2, 0);
        StateNode state = tree.getStates().get(0);
        assertSpan("state", state, 0, 0, 1, 14);
        StateCallNode call = state.getStates().get(0);
        assertEquals("user.present", call.getName());
        assertSpan("call", call, 1, 2, 1, 14);
        assertTrue(call.getParameters().isEmpty());
    }

    @Test
    public void testUnfinishedStateId() {
        Tree tree = SlsParser.parse("jdoe\n");

        assertSpan("tree", tree, 0, 0, 1, 0);
        assertEquals(1, tree.getStates().size());
        StateNode state = tree.getStates().get(0);
        assertEquals("jdoe", state.getIdentifier());
        assertSpan("state", state, 0, 0, 0, 4);
        assertTrue(state.getStates().isEmpty());
    }

    @Test
    public void testScanErrorRecovery() {
        Tree tree = SlsParser.parse(String.join("\n",
                "/etc/systemd/system/rootco-salt-backup.service:",
                "  file.managed:",
                "    - user: root",
                "    - group: root",
                "  virt",
                ""
        ));

        assertSpan("tree", tree, 0, 0, 5, 0);
        StateNode state = tree.getStates().get(0);
        assertSpan("state", state, 0, 0, 5, 0);
        assertEquals(2, state.getStates().size());

        StateCallNode managed = state.getStates().get(0);
        assertSpan("file.managed", managed, 1, 2, 4, 2);
        assertSpan("user", managed.getParameters().get(0), 2, 4, 3, 4);
        assertSpan("group", managed.getParameters().get(1), 3, 4, 4, 2);
        assertEquals("root", managed.getParameters().get(1).getValue());

        StateCallNode virt = state.getStates().get(1);
        assertEquals("salvaged from the failed scan", "virt", virt.getName());
        assertSpan("virt", virt, 4, 2, 5, 0);
    }

    @Test
    public void testUnterminatedQuoteKeepsTree() {
        Tree tree = SlsParser.parse(String.join("\n",
                "motd:",
                "  file.managed:",
                "    - contents: \"hello",
                ""
        ));

        StateNode state = tree.getStates().get(0);
        assertEquals("motd", state.getIdentifier());
        StateParameterNode contents = state.getStates().get(0).getParameters().get(0);
        assertEquals("contents", contents.getName());
        assertNotNull("open nodes are stretched to the error", contents.getEnd());
        assertNotNull(tree.getEnd());
    }

    @Test
    public void testFlowCollectionsCloseTheirCall() {
        Tree tree = SlsParser.parse(String.join("\n",
                "apache2:",
                "   pkg.installed: []",
                "   service.running:",
                "     - enable: true",
                "     - require:",
                "       - pkg: apache2",
                "   file.managed: {}",
                ""
        ));

        assertSpan("tree", tree, 0, 0, 7, 0);
        StateNode state = tree.getStates().get(0);
        assertSpan("apache2", state, 0, 0, 7, 0);
        assertEquals(3, state.getStates().size());

        StateCallNode installed = state.getStates().get(0);
        assertEquals("pkg.installed", installed.getName());
        assertSpan("pkg.installed", installed, 1, 3, 1, 20);
        assertTrue(installed.getParameters().isEmpty());

        StateCallNode running = state.getStates().get(1);
        assertSpan("service.running", running, 2, 3, 6, 3);
        assertSpan("enable", running.getParameters().get(0), 3, 5, 4, 5);
        assertEquals("true", running.getParameters().get(0).getValue());
        RequisitesNode require = running.getRequisites().get(0);
        assertSpan("require", require, 4, 5, 6, 3);
        RequisiteNode pkg = require.getRequisites().get(0);
        assertEquals("pkg", pkg.getModule());
        assertEquals("apache2", pkg.getReference());
        assertSpan("pkg requisite", pkg, 5, 7, 6, 3);

        StateCallNode managed = state.getStates().get(2);
        assertSpan("file.managed", managed, 6, 3, 6, 19);
    }

    @Test
    public void testLeadingBlankLine() {
        Tree tree = SlsParser.parse(String.join("\n",
                "",
                "root:",
                "  user.present",
                "",
                "ilmehtar:",
                "  user.present:",
                "    - fullname: Richard Brown",
                "    - home: /home/ilmehtar",
                ""
        ));

        assertSpan("tree", tree, 0, 0, 8, 0);
        assertEquals(2, tree.getStates().size());
        StateNode root = tree.getStates().get(0);
        assertSpan("root", root, 1, 0, 2, 14);
        assertSpan("root call", root.getStates().get(0), 2, 2, 2, 14);

        StateNode user = tree.getStates().get(1);
        assertSpan("ilmehtar", user, 4, 0, 8, 0);
        List<StateParameterNode> params = user.getStates().get(0).getParameters();
        assertEquals("Richard Brown", params.get(0).getValue());
        assertSpan("home", params.get(1), 7, 4, 8, 0);
    }

    @Test
    public void testEmptyDocument() {
        Tree tree = SlsParser.parse("");

        assertSpan("tree", tree, 0, 0, 0, 0);
        assertTrue(tree.getChildren().isEmpty());
        assertNull(tree.getIncludes());
        assertNull(tree.getExtend());
    }

    @Test
    public void testVisitFindsParameter() {
        Tree tree = SlsParser.parse(TWO_PARAMS);
        Position position = pos(2, 8);
        AstNode[] found = new AstNode[1];

        tree.visit(node -> {
            if (node.contains(position)) {
                found[0] = node;
            }
            return true;
        });

        assertTrue(found[0] instanceof StateParameterNode);
        assertEquals("user", ((StateParameterNode) found[0]).getName());
        assertSpan("user", found[0], 2, 4, 3, 4);
    }

    @Test(expected = NullPointerException.class)
    public void testNullDocument() {
        SlsParser.parse(null);
    }
}
