package com.solfmt.plugins.solidity.parser;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.solfmt.plugins.solidity.ast.AliasedImport;
import com.solfmt.plugins.solidity.ast.Comment;
import com.solfmt.plugins.solidity.ast.ContractDefinition;
import com.solfmt.plugins.solidity.ast.ContractKind;
import com.solfmt.plugins.solidity.ast.DocComment;
import com.solfmt.plugins.solidity.ast.EnumDefinition;
import com.solfmt.plugins.solidity.ast.FunctionDefinition;
import com.solfmt.plugins.solidity.ast.FunctionKind;
import com.solfmt.plugins.solidity.ast.OpaqueDefinition;
import com.solfmt.plugins.solidity.ast.PlainImport;
import com.solfmt.plugins.solidity.ast.PragmaDirective;
import com.solfmt.plugins.solidity.ast.RenamedImport;
import com.solfmt.plugins.solidity.ast.SourceText;
import com.solfmt.plugins.solidity.ast.SourceUnit;
import com.solfmt.plugins.solidity.ast.SourceUnitPart;
import com.solfmt.plugins.solidity.ast.VariableDefinition;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link SolidityParser}. */
@RunWith(JUnit4.class)
public final class SolidityParserTest {
    private SourceText source;

    private List<SourceUnitPart> parse(String... lines) throws Exception {
        source = SourceText.of(String.join("\n", lines));
        SourceUnit unit = SolidityParser.parse(source);
        return unit.getParts();
    }

    private ContractDefinition parseContract(String... lines) throws Exception {
        List<SourceUnitPart> parts = parse(lines);
        assertThat(parts).hasSize(1);
        return (ContractDefinition) parts.get(0);
    }

    private static ParseException parseError(String text) {
        return assertThrows(ParseException.class, () -> SolidityParser.parse(SourceText.of(text)));
    }

    @Test
    public void emptyFile() throws Exception {
        assertThat(parse("")).isEmpty();
        assertThat(parse("  ", "")).isEmpty();
    }

    @Test
    public void pragmaKeepsRawValue() throws Exception {
        List<SourceUnitPart> parts = parse("pragma solidity   >=0.8.0  <0.9.0 ;");

        PragmaDirective pragma = (PragmaDirective) parts.get(0);
        assertThat(pragma.getName()).isEqualTo("solidity");
        assertThat(pragma.getValue()).isEqualTo(">=0.8.0  <0.9.0");
        assertThat(pragma.isVersionPragma()).isTrue();
    }

    @Test
    public void pragmaWithoutValue() throws Exception {
        PragmaDirective pragma = (PragmaDirective) parse("pragma abicoder;").get(0);

        assertThat(pragma.getName()).isEqualTo("abicoder");
        assertThat(pragma.getValue()).isEmpty();
        assertThat(pragma.isVersionPragma()).isFalse();
    }

    @Test
    public void importForms() throws Exception {
        List<SourceUnitPart> parts = parse(
                "import \"a.sol\";",
                "import './b.sol' as B;",
                "import * as C from \"c.sol\";",
                "import {X, Y as Z} from \"d.sol\";");

        assertThat(parts).hasSize(4);
        assertThat(((PlainImport) parts.get(0)).getPath()).isEqualTo("a.sol");

        AliasedImport aliased = (AliasedImport) parts.get(1);
        assertThat(aliased.getPath()).isEqualTo("./b.sol");
        assertThat(aliased.getAlias()).isEqualTo("B");

        AliasedImport star = (AliasedImport) parts.get(2);
        assertThat(star.getPath()).isEqualTo("c.sol");
        assertThat(star.getAlias()).isEqualTo("C");

        RenamedImport renamed = (RenamedImport) parts.get(3);
        assertThat(renamed.getPath()).isEqualTo("d.sol");
        assertThat(renamed.getSymbols()).hasSize(2);
        assertThat(renamed.getSymbols().get(0).getName()).isEqualTo("X");
        assertThat(renamed.getSymbols().get(0).getAlias()).isNull();
        assertThat(renamed.getSymbols().get(1).toString()).isEqualTo("Y as Z");
    }

    @Test
    public void emptyImportList() throws Exception {
        RenamedImport renamed = (RenamedImport) parse("import {} from \"x.sol\";").get(0);

        assertThat(renamed.getSymbols()).isEmpty();
    }

    @Test
    public void contractHeader() throws Exception {
        ContractDefinition contract = parseContract("contract Token is ERC20(\"T\", \"T\"), Ownable, lib.Base {}");

        assertThat(contract.getKind()).isEqualTo(ContractKind.CONTRACT);
        assertThat(contract.getName()).isEqualTo("Token");
        assertThat(contract.getBases()).hasSize(3);
        assertThat(source.text(contract.getBases().get(0).getLoc())).isEqualTo("ERC20(\"T\", \"T\")");
        assertThat(source.text(contract.getBases().get(2).getLoc())).isEqualTo("lib.Base");
        assertThat(contract.getParts()).isEmpty();
    }

    @Test
    public void contractKinds() throws Exception {
        List<SourceUnitPart> parts = parse(
                "abstract contract A {}",
                "interface I {}",
                "library L {}",
                "contract C {}");

        assertThat(((ContractDefinition) parts.get(0)).getKind()).isEqualTo(ContractKind.ABSTRACT_CONTRACT);
        assertThat(((ContractDefinition) parts.get(1)).getKind()).isEqualTo(ContractKind.INTERFACE);
        assertThat(((ContractDefinition) parts.get(2)).getKind()).isEqualTo(ContractKind.LIBRARY);
        assertThat(((ContractDefinition) parts.get(3)).getKind()).isEqualTo(ContractKind.CONTRACT);
    }

    @Test
    public void contractMembers() throws Exception {
        ContractDefinition contract = parseContract(
                "contract C {",
                "    uint256 public total = f(1, 2);",
                "    struct S { uint a; }",
                "    event Moved(address indexed from);",
                "    enum Color { Red, Green }",
                "    constructor(uint a) payable {}",
                "    function f(uint a, uint b) external pure returns (uint) { return a + b; }",
                "    function g() external;",
                "    modifier only() { _; }",
                "    receive() external payable {}",
                "}");

        assertThat(contract.getParts()).hasSize(9);

        VariableDefinition variable = (VariableDefinition) contract.getParts().get(0);
        assertThat(source.text(variable.getDeclaration())).isEqualTo("uint256 public total = f(1, 2)");

        OpaqueDefinition struct = (OpaqueDefinition) contract.getParts().get(1);
        assertThat(struct.getKeyword()).isEqualTo("struct");
        assertThat(struct.isTerminated()).isFalse();
        assertThat(source.text(struct.getDeclaration())).isEqualTo("struct S { uint a; }");

        OpaqueDefinition event = (OpaqueDefinition) contract.getParts().get(2);
        assertThat(event.isTerminated()).isTrue();
        assertThat(source.text(event.getDeclaration())).isEqualTo("event Moved(address indexed from)");

        EnumDefinition color = (EnumDefinition) contract.getParts().get(3);
        assertThat(color.getName()).isEqualTo("Color");
        assertThat(color.getValues()).containsExactly("Red", "Green").inOrder();

        FunctionDefinition constructor = (FunctionDefinition) contract.getParts().get(4);
        assertThat(constructor.getKind()).isEqualTo(FunctionKind.CONSTRUCTOR);
        assertThat(source.text(constructor.getSignature())).isEqualTo("constructor(uint a) payable");

        FunctionDefinition f = (FunctionDefinition) contract.getParts().get(5);
        assertThat(f.getKind()).isEqualTo(FunctionKind.FUNCTION);
        assertThat(source.text(f.getSignature())).isEqualTo("function f(uint a, uint b) external pure returns (uint)");
        assertThat(source.text(f.getBody().getLoc())).isEqualTo("{ return a + b; }");

        FunctionDefinition g = (FunctionDefinition) contract.getParts().get(6);
        assertThat(g.hasBody()).isFalse();

        assertThat(((FunctionDefinition) contract.getParts().get(7)).getKind()).isEqualTo(FunctionKind.MODIFIER);
        assertThat(((FunctionDefinition) contract.getParts().get(8)).getKind()).isEqualTo(FunctionKind.RECEIVE);
    }

    @Test
    public void nestedBracesInBodies() throws Exception {
        ContractDefinition contract = parseContract(
                "contract C {",
                "    function f() public {",
                "        if (x) { y(); } else { z(\"}\"); }",
                "    }",
                "}");

        FunctionDefinition f = (FunctionDefinition) contract.getParts().get(0);
        assertThat(source.text(f.getBody().getLoc())).endsWith("else { z(\"}\"); }\n    }");
    }

    @Test
    public void natSpecIsAttachedToTheNextDeclaration() throws Exception {
        ContractDefinition contract = parseContract(
                "/// @title Vault",
                "/// keeps funds",
                "contract Vault {",
                "    /**",
                "     * Deposits ether.",
                "     * @param to the receiver",
                "     * @return",
                "     */",
                "    function deposit(address to) external returns (bool) {}",
                "}");

        assertThat(contract.getDocs()).hasSize(1);
        assertThat(contract.getDocs().get(0).getTag()).isEqualTo("title");
        assertThat(contract.getDocs().get(0).getValue()).isEqualTo("Vault keeps funds");
        assertThat(contract.getLoc().getStart()).isEqualTo(0);

        List<DocComment> docs = ((FunctionDefinition) contract.getParts().get(0)).getDocs();
        assertThat(docs).hasSize(3);
        assertThat(docs.get(0).getTag()).isEqualTo("notice");
        assertThat(docs.get(0).getValue()).isEqualTo("Deposits ether.");
        assertThat(docs.get(1).getTag()).isEqualTo("param");
        assertThat(docs.get(1).getValue()).isEqualTo("to the receiver");
        assertThat(docs.get(2).getTag()).isEqualTo("return");
        assertThat(docs.get(2).getValue()).isEmpty();
    }

    @Test
    public void commentsBecomeParts() throws Exception {
        List<SourceUnitPart> parts = parse(
                "// SPDX-License-Identifier: MIT",
                "pragma solidity ^0.8.0; // compiler",
                "/* block */",
                "//// not natspec",
                "contract C {}");

        assertThat(parts).hasSize(6);
        Comment license = (Comment) parts.get(0);
        assertThat(license.getText()).isEqualTo("// SPDX-License-Identifier: MIT");
        assertThat(license.isTrailing()).isFalse();

        Comment trailing = (Comment) parts.get(2);
        assertThat(trailing.isTrailing()).isTrue();
        assertThat(trailing.getText()).isEqualTo("// compiler");

        assertThat(((Comment) parts.get(3)).isBlock()).isTrue();
        assertThat(((Comment) parts.get(4)).getText()).isEqualTo("//// not natspec");
        assertThat(((ContractDefinition) parts.get(5)).getDocs()).isEmpty();
    }

    @Test
    public void danglingNatSpecIsKeptAsComment() throws Exception {
        List<SourceUnitPart> parts = parse("contract C {}", "/// @notice orphan");

        assertThat(parts).hasSize(2);
        assertThat(((Comment) parts.get(1)).getText()).isEqualTo("/// @notice orphan");
    }

    @Test
    public void carriageReturnIsNotPartOfLineComment() throws Exception {
        List<SourceUnitPart> parts = parse("// one\r", "contract C {}");

        assertThat(((Comment) parts.get(0)).getText()).isEqualTo("// one");
    }

    @Test
    public void commentsInImportListAttachToSymbols() throws Exception {
        RenamedImport renamed = (RenamedImport) parse(
                "import /* header */ {A, /* B */ C // last",
                "} from \"x.sol\";").get(0);

        assertThat(renamed.getSymbols()).hasSize(2);
        assertThat(_texts(renamed.getSymbols().get(0).getComments())).containsExactly("/* B */");
        assertThat(_texts(renamed.getSymbols().get(1).getComments())).containsExactly("// last");
        assertThat(_texts(renamed.getDetachedComments())).containsExactly("/* header */");
    }

    @Test
    public void commentsInBaseListAttachToBases() throws Exception {
        ContractDefinition contract = parseContract("contract C /* c */ is /* first */ A /* x */, B(1 /* arg */) // b", "{}");

        assertThat(contract.getBases()).hasSize(2);
        assertThat(_texts(contract.getBases().get(0).getComments())).containsExactly("/* first */", "/* x */").inOrder();
        assertThat(_texts(contract.getBases().get(1).getComments())).containsExactly("// b");
        assertThat(source.text(contract.getBases().get(1).getLoc())).isEqualTo("B(1 /* arg */)");
        assertThat(_texts(contract.getDetachedComments())).containsExactly("/* c */");
    }

    @Test
    public void commentsInEnumAttachToValues() throws Exception {
        EnumDefinition enumeration = (EnumDefinition) parse(
                "enum E { A, // first",
                "  B /* second */ }").get(0);

        assertThat(enumeration.getValues()).containsExactly("A", "B").inOrder();
        assertThat(_texts(enumeration.getCommentsAfter(0))).containsExactly("// first");
        assertThat(_texts(enumeration.getCommentsAfter(1))).containsExactly("/* second */");

        EnumDefinition empty = (EnumDefinition) parse("enum E { /* none */ }").get(0);
        assertThat(_texts(empty.getDetachedComments())).containsExactly("/* none */");
    }

    @Test
    public void commentsBeforeTerminatorAreDetached() throws Exception {
        ContractDefinition contract = parseContract(
                "contract C {",
                "    uint x // why",
                "    ;",
                "    function f() public // note",
                "    {",
                "        x;",
                "    }",
                "    function g(uint /* a */ b) external /* c */;",
                "}");

        VariableDefinition variable = (VariableDefinition) contract.getParts().get(0);
        assertThat(source.text(variable.getDeclaration())).isEqualTo("uint x");
        assertThat(_texts(variable.getDetachedComments())).containsExactly("// why");

        FunctionDefinition f = (FunctionDefinition) contract.getParts().get(1);
        assertThat(source.text(f.getSignature())).isEqualTo("function f() public");
        assertThat(_texts(f.getDetachedComments())).containsExactly("// note");

        FunctionDefinition g = (FunctionDefinition) contract.getParts().get(2);
        assertThat(source.text(g.getSignature())).isEqualTo("function g(uint /* a */ b) external");
        assertThat(_texts(g.getDetachedComments())).containsExactly("/* c */");
    }

    @Test
    public void commentsInPragmaAreDetached() throws Exception {
        PragmaDirective pragma = (PragmaDirective) parse("pragma /* p */ solidity >=0.8.0 /* x */ <0.9.0 // y", ";").get(0);

        assertThat(pragma.getValue()).isEqualTo(">=0.8.0 <0.9.0");
        assertThat(_texts(pragma.getDetachedComments())).containsExactly("/* p */", "/* x */", "// y").inOrder();
    }

    @Test
    public void emptyNatSpecStaysAComment() throws Exception {
        List<SourceUnitPart> parts = parse("/** */", "contract C {}");

        assertThat(parts).hasSize(2);
        assertThat(((Comment) parts.get(0)).getText()).isEqualTo("/** */");
        assertThat(((ContractDefinition) parts.get(1)).getDocs()).isEmpty();
    }

    private static List<String> _texts(List<Comment> comments) {
        List<String> texts = new ArrayList<>();
        for (Comment comment : comments) {
            texts.add(comment.getText());
        }
        return texts;
    }

    @Test
    public void reportsPositionOfSyntaxErrors() {
        ParseException e = parseError("pragma solidity ^0.8.0;\ncontract {}");

        assertThat(e.getLine()).isEqualTo(2);
        assertThat(e.getColumn()).isEqualTo(10);
        assertThat(e).hasMessageThat().startsWith("2:10: expected identifier");
    }

    @Test
    public void rejectsUnterminatedConstructs() {
        assertThat(parseError("contract C {").getReason()).contains("end of file");
        assertThat(parseError("/* open").getReason()).isEqualTo("unterminated comment");
        assertThat(parseError("import \"a.sol;\n").getReason()).isEqualTo("unterminated string literal");
        assertThat(parseError("contract C { function f() public { }").getReason()).contains("end of file");
    }

    @Test
    public void directivesAreOnlyAllowedAtFileLevel() {
        assertThat(parseError("contract C { pragma solidity ^0.8.0; }").getReason())
                .contains("only allowed at file level");
        assertThat(parseError("contract C { contract D {} }").getReason()).contains("nested");
    }
}
