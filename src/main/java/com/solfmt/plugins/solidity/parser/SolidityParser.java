package com.solfmt.plugins.solidity.parser;

import com.solfmt.plugins.solidity.ast.AliasedImport;
import com.solfmt.plugins.solidity.ast.Block;
import com.solfmt.plugins.solidity.ast.Comment;
import com.solfmt.plugins.solidity.ast.ContractDefinition;
import com.solfmt.plugins.solidity.ast.ContractKind;
import com.solfmt.plugins.solidity.ast.ContractPart;
import com.solfmt.plugins.solidity.ast.DocComment;
import com.solfmt.plugins.solidity.ast.EnumDefinition;
import com.solfmt.plugins.solidity.ast.FunctionDefinition;
import com.solfmt.plugins.solidity.ast.FunctionKind;
import com.solfmt.plugins.solidity.ast.InheritanceSpecifier;
import com.solfmt.plugins.solidity.ast.Loc;
import com.solfmt.plugins.solidity.ast.OpaqueDefinition;
import com.solfmt.plugins.solidity.ast.PlainImport;
import com.solfmt.plugins.solidity.ast.PragmaDirective;
import com.solfmt.plugins.solidity.ast.RenamedImport;
import com.solfmt.plugins.solidity.ast.SourceText;
import com.solfmt.plugins.solidity.ast.SourceUnit;
import com.solfmt.plugins.solidity.ast.SourceUnitPart;
import com.solfmt.plugins.solidity.ast.VariableDefinition;

import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recursive-descent parser for the declaration level of Solidity.
 *
 * <p>Directives, contract headers, enums and import lists are parsed structurally. Function
 * signatures, function bodies, variable declarations and the definitions in
 * {@link #OPAQUE_KEYWORDS} are only delimited, and kept as source ranges.
 *
 * <p>Comments met while parsing a structural construct are attached to the nearest list item, or
 * else detached from the construct, so none is lost when its layout is rebuilt.
 */
public final class SolidityParser {
    private static final Set<String> CONTRACT_KEYWORDS = Set.of("contract", "interface", "library", "abstract");
    private static final Set<String> OPAQUE_KEYWORDS = Set.of("struct", "event", "error", "using", "type");

    private final SourceText source;
    private final List<Token> tokens;
    private final List<Comment> skippedComments = new ArrayList<>();
    private int index;

    private SolidityParser(SourceText source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /**
     * Parses a complete source file.
     *
     * @throws ParseException on the first syntax error
     */
    public static SourceUnit parse(SourceText source) throws ParseException {
        List<Token> tokens = new Lexer(source).tokenize();
        return new SolidityParser(source, tokens).parseSourceUnit();
    }

    private SourceUnit parseSourceUnit() throws ParseException {
        List<SourceUnitPart> parts = parseMembers(true);
        return new SourceUnit(new Loc(0, source.length()), parts);
    }

    /**
     * Parses the members of a file or of a contract body, up to end of file or the closing brace.
     * NatSpec comments are collected and attached to the next declaration; all other comments
     * become {@link Comment} parts.
     */
    private List<SourceUnitPart> parseMembers(boolean topLevel) throws ParseException {
        List<SourceUnitPart> parts = new ArrayList<>();
        List<Token> pendingDocs = new ArrayList<>();

        while (true) {
            Token token = tokens.get(index);
            if (token.kind == TokenKind.EOF) {
                if (!topLevel) {
                    throw error(token, "expected '}' but found end of file");
                }
                break;
            }
            if (!topLevel && token.is("}")) {
                break;
            }

            if (token.kind.isComment()) {
                index++;
                if (pendingDocs.isEmpty() && _isTrailing(parts, token)) {
                    parts.add(new Comment(token.loc(), text(token), true));
                } else if (token.kind.isDocComment() && !_isEmptyDoc(token)) {
                    pendingDocs.add(token);
                } else {
                    _flushDocs(pendingDocs, parts);
                    parts.add(new Comment(token.loc(), text(token), false));
                }
                continue;
            }

            if (token.is("pragma") || token.is("import")) {
                if (!topLevel) {
                    throw error(token, "'" + token.text + "' is only allowed at file level");
                }
                _flushDocs(pendingDocs, parts);
                parts.add(token.is("pragma") ? parsePragma() : parseImport());
                continue;
            }

            parts.add(parseDeclaration(topLevel, pendingDocs));
            pendingDocs.clear();
        }

        _flushDocs(pendingDocs, parts);
        return parts;
    }

    private SourceUnitPart parseDeclaration(boolean topLevel, List<Token> docTokens) throws ParseException {
        Token token = tokens.get(index);
        if (token.kind != TokenKind.IDENTIFIER) {
            throw error(token, "expected a declaration but found " + token);
        }
        int start = docTokens.isEmpty() ? token.start : docTokens.get(0).start;
        List<DocComment> docs = parseDocComments(docTokens);

        if (CONTRACT_KEYWORDS.contains(token.text)) {
            if (!topLevel) {
                throw error(token, "nested '" + token.text + "' definitions are not allowed");
            }
            return parseContract(start, docs);
        }
        if (token.is("enum")) {
            return parseEnum(start, docs);
        }
        if (FunctionKind.forKeyword(token.text).isPresent()) {
            return parseFunction(start, docs);
        }
        if (token.is("struct")) {
            Token keyword = tokens.get(index);
            while (!tokens.get(index).is("{")) {
                if (tokens.get(index).kind == TokenKind.EOF || tokens.get(index).is(";")) {
                    throw error(tokens.get(index), "expected '{' in struct definition");
                }
                index++;
            }
            Block body = parseBlock();
            Loc declaration = new Loc(keyword.start, body.getLoc().getEnd());
            return new OpaqueDefinition(new Loc(start, declaration.getEnd()), docs, List.of(), keyword.text,
                    declaration, false);
        }
        if (OPAQUE_KEYWORDS.contains(token.text)) {
            Token keyword = tokens.get(index);
            Loc declaration = scanToSemicolon();
            Token semicolon = tokens.get(index - 1);
            return new OpaqueDefinition(new Loc(start, semicolon.end), docs, _takeSkippedComments(), keyword.text,
                    declaration, true);
        }

        Loc declaration = scanToSemicolon();
        Token semicolon = tokens.get(index - 1);
        return new VariableDefinition(new Loc(start, semicolon.end), docs, _takeSkippedComments(), declaration);
    }

    /**
     * The value keeps the spacing between its tokens as written. A comment inside it is detached
     * and counts as a single space.
     */
    private PragmaDirective parsePragma() throws ParseException {
        Token pragma = advance();
        Token name = expectIdentifier();

        StringBuilder value = new StringBuilder();
        Token previous = null;
        boolean commentSincePrevious = false;
        Token token = tokens.get(index);
        while (!token.is(";")) {
            if (token.kind == TokenKind.EOF) {
                throw error(token, "expected ';' after pragma");
            }
            if (token.kind.isComment()) {
                skippedComments.add(comment(token));
                commentSincePrevious = true;
            } else {
                if (previous != null) {
                    value.append(commentSincePrevious ? " " : text(previous.end, token.start));
                }
                value.append(text(token));
                previous = token;
                commentSincePrevious = false;
            }
            token = tokens.get(++index);
        }
        index++;
        return new PragmaDirective(new Loc(pragma.start, token.end), name.text, value.toString(),
                _takeSkippedComments());
    }

    private SourceUnitPart parseImport() throws ParseException {
        Token importToken = advance();
        Token token = structural();

        if (token.kind == TokenKind.STRING) {
            String path = stringContent(advance());
            if (structural().is("as")) {
                advance();
                String alias = expectIdentifier().text;
                Token semicolon = expect(";");
                return new AliasedImport(new Loc(importToken.start, semicolon.end), path, alias,
                        _takeSkippedComments());
            }
            Token semicolon = expect(";");
            return new PlainImport(new Loc(importToken.start, semicolon.end), path, _takeSkippedComments());
        }

        if (token.is("*")) {
            advance();
            expect("as");
            String alias = expectIdentifier().text;
            expect("from");
            String path = stringContent(expectString());
            Token semicolon = expect(";");
            return new AliasedImport(new Loc(importToken.start, semicolon.end), path, alias,
                    _takeSkippedComments());
        }

        if (token.is("{")) {
            advance();
            List<Comment> detached = _takeSkippedComments();
            List<String> names = new ArrayList<>();
            List<String> aliases = new ArrayList<>();
            List<Loc> ranges = new ArrayList<>();
            while (!structural().is("}")) {
                Token name = expectIdentifier();
                Token last = name;
                String alias = null;
                if (structural().is("as")) {
                    advance();
                    last = expectIdentifier();
                    alias = last.text;
                }
                names.add(name.text);
                aliases.add(alias);
                ranges.add(new Loc(name.start, last.end));
                if (!structural().is(",")) {
                    break;
                }
                advance();
            }
            expect("}");

            List<RenamedImport.Symbol> symbols = new ArrayList<>();
            if (names.isEmpty()) {
                detached.addAll(_takeSkippedComments());
            } else {
                List<List<Comment>> comments = _attachToItems(_takeSkippedComments(), ranges);
                for (int i = 0; i < names.size(); i++) {
                    symbols.add(new RenamedImport.Symbol(names.get(i), aliases.get(i), comments.get(i)));
                }
            }

            expect("from");
            String path = stringContent(expectString());
            Token semicolon = expect(";");
            detached.addAll(_takeSkippedComments());
            return new RenamedImport(new Loc(importToken.start, semicolon.end), path, symbols, detached);
        }

        throw error(token, "expected a path, '*' or '{' after 'import' but found " + token);
    }

    private ContractDefinition parseContract(int start, List<DocComment> docs) throws ParseException {
        Token keyword = advance();
        ContractKind kind;
        if (keyword.is("abstract")) {
            expect("contract");
            kind = ContractKind.ABSTRACT_CONTRACT;
        } else if (keyword.is("interface")) {
            kind = ContractKind.INTERFACE;
        } else if (keyword.is("library")) {
            kind = ContractKind.LIBRARY;
        } else {
            kind = ContractKind.CONTRACT;
        }
        String name = expectIdentifier().text;
        boolean inherits = structural().is("is");
        List<Comment> detached = _takeSkippedComments();

        List<Loc> ranges = new ArrayList<>();
        if (inherits) {
            advance();
            do {
                ranges.add(parseInheritanceSpecifier());
            } while (_consume(","));
        }
        expect("{");

        List<InheritanceSpecifier> bases = new ArrayList<>();
        if (ranges.isEmpty()) {
            detached.addAll(_takeSkippedComments());
        } else {
            List<List<Comment>> comments = _attachToItems(_takeSkippedComments(), ranges);
            for (int i = 0; i < ranges.size(); i++) {
                bases.add(new InheritanceSpecifier(ranges.get(i), comments.get(i)));
            }
        }

        List<ContractPart> parts = parseMembers(false).stream()
                .map(ContractPart.class::cast)
                .collect(Collectors.toList());
        Token close = expect("}");
        return new ContractDefinition(new Loc(start, close.end), docs, detached, kind, name, bases, parts);
    }

    /** @return the range of one base, from its name through its closing argument parenthesis */
    private Loc parseInheritanceSpecifier() throws ParseException {
        Token first = expectIdentifier();
        Token last = first;
        while (structural().is(".")) {
            advance();
            last = expectIdentifier();
        }
        if (structural().is("(")) {
            last = skipBalanced("(", ")");
        }
        return new Loc(first.start, last.end);
    }

    private EnumDefinition parseEnum(int start, List<DocComment> docs) throws ParseException {
        advance();
        String name = expectIdentifier().text;
        expect("{");
        List<Comment> detached = _takeSkippedComments();

        List<String> values = new ArrayList<>();
        List<Loc> ranges = new ArrayList<>();
        while (!structural().is("}")) {
            Token value = expectIdentifier();
            values.add(value.text);
            ranges.add(value.loc());
            if (!structural().is(",")) {
                break;
            }
            advance();
        }
        Token close = expect("}");

        List<List<Comment>> comments;
        if (values.isEmpty()) {
            detached.addAll(_takeSkippedComments());
            comments = List.of();
        } else {
            comments = _attachToItems(_takeSkippedComments(), ranges);
        }
        return new EnumDefinition(new Loc(start, close.end), docs, detached, name, values, comments);
    }

    private FunctionDefinition parseFunction(int start, List<DocComment> docs) throws ParseException {
        Token keyword = advance();
        FunctionKind kind = FunctionKind.forKeyword(keyword.text).orElseThrow();

        Token last = keyword;
        List<Comment> afterSignature = new ArrayList<>();
        int depth = 0;
        while (true) {
            Token token = tokens.get(index);
            if (token.kind == TokenKind.EOF) {
                throw error(token, "unexpected end of file in " + kind.getKeyword() + " signature");
            }
            if (token.kind.isComment()) {
                afterSignature.add(comment(token));
            } else {
                if (depth == 0 && (token.is("{") || token.is(";"))) {
                    break;
                }
                depth = _adjustDepth(token, depth);
                afterSignature.clear();
                last = token;
            }
            index++;
        }
        Loc signature = new Loc(keyword.start, last.end);

        if (tokens.get(index).is(";")) {
            Token semicolon = advance();
            return new FunctionDefinition(new Loc(start, semicolon.end), docs, afterSignature, kind, signature, null);
        }
        Block body = parseBlock();
        return new FunctionDefinition(new Loc(start, body.getLoc().getEnd()), docs, afterSignature, kind, signature,
                body);
    }

    /** Delimits a brace block by nesting only; its statements are not parsed. */
    private Block parseBlock() throws ParseException {
        Token open = tokens.get(index);
        Token close = skipBalanced("{", "}");
        return new Block(new Loc(open.start, close.end));
    }

    /**
     * Skips from the current token, which must be {@code open}, to its matching {@code close}.
     * Comments inside are part of the skipped range.
     *
     * @return the closing token
     */
    private Token skipBalanced(String open, String close) throws ParseException {
        Token first = expect(open);
        int depth = 1;
        while (true) {
            Token token = tokens.get(index);
            if (token.kind == TokenKind.EOF) {
                throw error(first, "unbalanced '" + open + "'");
            }
            index++;
            if (token.is(open)) {
                depth++;
            } else if (token.is(close) && --depth == 0) {
                return token;
            }
        }
    }

    /**
     * Delimits a declaration ending with a {@code ;} at nesting depth zero and consumes the
     * {@code ;}. Comments between the last token and the {@code ;} are collected as skipped
     * comments.
     *
     * @return the range of the declaration, excluding the {@code ;}
     */
    private Loc scanToSemicolon() throws ParseException {
        Token first = tokens.get(index);
        Token last = first;
        List<Comment> beforeSemicolon = new ArrayList<>();
        int depth = 0;
        while (true) {
            Token token = tokens.get(index);
            if (token.kind == TokenKind.EOF) {
                throw error(token, "expected ';' but found end of file");
            }
            if (token.kind.isComment()) {
                beforeSemicolon.add(comment(token));
            } else {
                if (depth == 0 && token.is(";")) {
                    break;
                }
                if (depth == 0 && token.is("}")) {
                    throw error(token, "expected ';' but found '}'");
                }
                depth = _adjustDepth(token, depth);
                beforeSemicolon.clear();
                last = token;
            }
            index++;
        }
        index++;
        skippedComments.addAll(beforeSemicolon);
        return new Loc(first.start, last.end);
    }

    private static int _adjustDepth(Token token, int depth) {
        if (token.is("(") || token.is("[") || token.is("{")) {
            return depth + 1;
        }
        if (token.is(")") || token.is("]") || token.is("}")) {
            return depth - 1;
        }
        return depth;
    }

    /**
     * Splits NatSpec comments into one {@link DocComment} per {@code @tag}. Untagged lines continue
     * the previous entry, or open a {@code @notice} entry.
     */
    private List<DocComment> parseDocComments(List<Token> docTokens) throws ParseException {
        List<DocComment> docs = new ArrayList<>();
        for (Token token : docTokens) {
            String raw = text(token);
            List<String> lines = new ArrayList<>();
            if (token.kind == TokenKind.DOC_LINE_COMMENT) {
                lines.add(raw.substring(3));
            } else {
                for (String line : raw.substring(3, raw.length() - 2).split("\n")) {
                    String stripped = line.strip();
                    lines.add(stripped.startsWith("*") ? stripped.substring(1) : stripped);
                }
            }

            for (String line : lines) {
                String content = line.strip();
                if (content.isEmpty()) {
                    continue;
                }
                if (content.startsWith("@")) {
                    int space = _firstWhitespace(content);
                    String tag = content.substring(1, space);
                    String value = content.substring(space).strip();
                    docs.add(new DocComment(token.loc(), tag, value));
                } else if (!docs.isEmpty()) {
                    DocComment previous = docs.remove(docs.size() - 1);
                    String value = previous.getValue().isEmpty() ? content : previous.getValue() + " " + content;
                    docs.add(new DocComment(previous.getLoc().union(token.loc()), previous.getTag(), value));
                } else {
                    docs.add(new DocComment(token.loc(), "notice", content));
                }
            }
        }
        return docs;
    }

    /** An empty NatSpec comment has no text to attach, so it stays an ordinary comment. */
    private boolean _isEmptyDoc(Token token) throws ParseException {
        return parseDocComments(List.of(token)).isEmpty();
    }

    private static int _firstWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return s.length();
    }

    /** NatSpec that ends up attached to nothing is kept as ordinary comments. */
    private void _flushDocs(List<Token> pendingDocs, List<SourceUnitPart> parts) throws ParseException {
        for (Token doc : pendingDocs) {
            parts.add(new Comment(doc.loc(), text(doc), false));
        }
        pendingDocs.clear();
    }

    private boolean _isTrailing(List<SourceUnitPart> parts, Token comment) {
        if (parts.isEmpty() || parts.get(parts.size() - 1) instanceof Comment) {
            return false;
        }
        int previousEnd = parts.get(parts.size() - 1).getLoc().getEnd();
        return source.countLineBreaks(previousEnd, comment.end) == 0;
    }

    private boolean _consume(String punctuation) throws ParseException {
        if (structural().is(punctuation)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * The current token in a position where the layout is rebuilt. Comments in front of it are
     * consumed and collected until the construct being parsed takes them.
     */
    private Token structural() throws ParseException {
        Token token = tokens.get(index);
        while (token.kind.isComment()) {
            skippedComments.add(comment(token));
            token = tokens.get(++index);
        }
        return token;
    }

    private List<Comment> _takeSkippedComments() {
        List<Comment> comments = new ArrayList<>(skippedComments);
        skippedComments.clear();
        return comments;
    }

    /**
     * Gives each comment to the last item that ends before it, or to the first item. Comments
     * inside an item's range are already part of that item's text and are dropped.
     */
    private static List<List<Comment>> _attachToItems(List<Comment> comments, List<Loc> items) {
        List<List<Comment>> attached = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            attached.add(new ArrayList<>());
        }
        for (Comment comment : comments) {
            Loc loc = comment.getLoc();
            int owner = 0;
            boolean inside = false;
            for (int i = 0; i < items.size(); i++) {
                Loc item = items.get(i);
                if (loc.getStart() >= item.getStart() && loc.getEnd() <= item.getEnd()) {
                    inside = true;
                    break;
                }
                if (item.getEnd() <= loc.getStart()) {
                    owner = i;
                }
            }
            if (!inside) {
                attached.get(owner).add(comment);
            }
        }
        return attached;
    }

    private Comment comment(Token token) throws ParseException {
        return new Comment(token.loc(), text(token), false);
    }

    private Token advance() {
        return tokens.get(index++);
    }

    private Token expect(String spelling) throws ParseException {
        Token token = structural();
        if (!token.is(spelling)) {
            throw error(token, "expected '" + spelling + "' but found " + token);
        }
        return advance();
    }

    private Token expectIdentifier() throws ParseException {
        Token token = structural();
        if (token.kind != TokenKind.IDENTIFIER) {
            throw error(token, "expected identifier but found " + token);
        }
        return advance();
    }

    private Token expectString() throws ParseException {
        Token token = structural();
        if (token.kind != TokenKind.STRING) {
            throw error(token, "expected string literal but found " + token);
        }
        return advance();
    }

    private String stringContent(Token token) throws ParseException {
        return text(token.start + 1, token.end - 1);
    }

    private String text(Token token) throws ParseException {
        return text(token.start, token.end);
    }

    private String text(int start, int end) throws ParseException {
        try {
            return source.text(start, end);
        } catch (CharacterCodingException e) {
            throw new ParseException("source is not valid UTF-8", source.lineOf(start), source.columnOf(start), e);
        }
    }

    private ParseException error(Token token, String message) {
        return new ParseException(message, source.lineOf(token.start), source.columnOf(token.start));
    }
}
