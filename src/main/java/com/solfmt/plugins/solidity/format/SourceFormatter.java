package com.solfmt.plugins.solidity.format;

import com.solfmt.plugins.solidity.ast.AliasedImport;
import com.solfmt.plugins.solidity.ast.Block;
import com.solfmt.plugins.solidity.ast.Comment;
import com.solfmt.plugins.solidity.ast.ContractDefinition;
import com.solfmt.plugins.solidity.ast.ContractPart;
import com.solfmt.plugins.solidity.ast.Declaration;
import com.solfmt.plugins.solidity.ast.DocComment;
import com.solfmt.plugins.solidity.ast.EnumDefinition;
import com.solfmt.plugins.solidity.ast.FunctionDefinition;
import com.solfmt.plugins.solidity.ast.FunctionKind;
import com.solfmt.plugins.solidity.ast.ImportDirective;
import com.solfmt.plugins.solidity.ast.InheritanceSpecifier;
import com.solfmt.plugins.solidity.ast.Loc;
import com.solfmt.plugins.solidity.ast.Node;
import com.solfmt.plugins.solidity.ast.NodeVisitor;
import com.solfmt.plugins.solidity.ast.OpaqueDefinition;
import com.solfmt.plugins.solidity.ast.PlainImport;
import com.solfmt.plugins.solidity.ast.PragmaDirective;
import com.solfmt.plugins.solidity.ast.RenamedImport;
import com.solfmt.plugins.solidity.ast.SourceText;
import com.solfmt.plugins.solidity.ast.SourceUnit;
import com.solfmt.plugins.solidity.ast.SourceUnitPart;
import com.solfmt.plugins.solidity.ast.VariableDefinition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Walks a Solidity syntax tree and writes its formatted text.
 *
 * <p>Declarations whose layout is modelled (directives, contract headers, enums) are rebuilt
 * from the tree. Everything else, such as function signatures and bodies or variable
 * declarations, is copied from the source range it was parsed from.
 *
 * <p>An instance formats exactly one file and is not thread-safe.
 */
public final class SourceFormatter implements NodeVisitor {
    private static final String SEPARATOR = ", ";

    private final LayoutWriter writer;
    private final SourceText source;
    private final SolidityStyle style;
    private final VersionNormalizer versionNormalizer;

    public SourceFormatter(LayoutWriter writer, SourceText source, SolidityStyle style,
                           VersionNormalizer versionNormalizer) {
        this.writer = writer;
        this.source = source;
        this.style = style;
        this.versionNormalizer = versionNormalizer;
    }

    /**
     * Formats {@code unit} into a string.
     *
     * @throws java.nio.charset.CharacterCodingException if a copied source range is not valid UTF-8
     */
    public static String format(SourceUnit unit, SourceText source, SolidityStyle style) throws IOException {
        StringBuilder out = new StringBuilder();
        format(unit, source, style, out);
        return out.toString();
    }

    /**
     * Formats {@code unit} into {@code out}. Any failure aborts the run; what was already appended to
     * {@code out} must then be discarded.
     */
    public static void format(SourceUnit unit, SourceText source, SolidityStyle style, Appendable out)
            throws IOException {
        LayoutWriter writer = new LayoutWriter(out, style.getTabWidth());
        new SourceFormatter(writer, source, style, new SemverRangeNormalizer()).format(unit);
    }

    public void format(SourceUnit unit) throws IOException {
        unit.accept(this);
        if (writer.getCaptureDepth() != 0) {
            throw new IllegalStateException("Unbalanced capture after formatting: " + writer.getCaptureDepth());
        }
    }

    @Override
    public void visit(SourceUnit unit) throws IOException {
        // TODO: decide whether pragma and import directives should be hoisted to the top of the file
        List<SourceUnitPart> parts = unit.getParts();
        for (int i = 0; i < parts.size(); i++) {
            SourceUnitPart part = parts.get(i);
            part.accept(this);
            Loc last = part.getLoc();

            if (_isTrailingComment(parts, i + 1)) {
                i++;
                last = writeTrailing((Comment) parts.get(i));
            }
            writer.writeLine();

            if (i + 1 < parts.size() && needsBlankLine(part, last, parts.get(i + 1))) {
                writer.writeLine();
            }
        }
    }

    /**
     * Top-level spacing: declarations are surrounded by blank lines, a pragma is always followed by
     * one and consecutive imports stay together. Around a comment the blank line is kept only if
     * the source had one.
     */
    private boolean needsBlankLine(SourceUnitPart current, Loc currentEnd, SourceUnitPart next) {
        if (current instanceof Comment) {
            return BlankLines.hadBlankLine(source, currentEnd, next.getLoc());
        }
        if (_isDeclaration(current) || current instanceof PragmaDirective || _isDeclaration(next)) {
            return true;
        }
        return next instanceof Comment && BlankLines.hadBlankLine(source, currentEnd, next.getLoc());
    }

    private static boolean _isDeclaration(SourceUnitPart part) {
        return part instanceof Declaration;
    }

    private static boolean _isTrailingComment(List<?> parts, int index) {
        return index < parts.size() && parts.get(index) instanceof Comment && ((Comment) parts.get(index)).isTrailing();
    }

    private Loc writeTrailing(Comment comment) throws IOException {
        writer.write(" ");
        comment.accept(this);
        return comment.getLoc();
    }

    @Override
    public void visit(PragmaDirective pragma) throws IOException {
        writeDetached(pragma.getDetachedComments());
        String value = pragma.getValue();
        if (pragma.isVersionPragma()) {
            value = versionNormalizer.normalize(value).orElse(value);
        }
        writer.write("pragma " + pragma.getName() + (value.isEmpty() ? "" : " " + value) + ";");
    }

    @Override
    public void visit(PlainImport plainImport) throws IOException {
        writeDetached(plainImport.getDetachedComments());
        writer.write("import " + _quote(plainImport) + ";");
    }

    @Override
    public void visit(AliasedImport aliasedImport) throws IOException {
        writeDetached(aliasedImport.getDetachedComments());
        writer.write("import " + _quote(aliasedImport) + " as " + aliasedImport.getAlias() + ";");
    }

    @Override
    public void visit(RenamedImport renamedImport) throws IOException {
        writeDetached(renamedImport.getDetachedComments());
        writer.write("import ");

        List<RenamedImport.Symbol> sorted = new ArrayList<>(renamedImport.getSymbols());
        sorted.sort(Comparator.comparing(RenamedImport.Symbol::toString));
        List<String> symbols = new ArrayList<>();
        List<List<Comment>> comments = new ArrayList<>();
        for (RenamedImport.Symbol symbol : sorted) {
            symbols.add(symbol.toString());
            comments.add(symbol.getComments());
        }

        if (symbols.isEmpty()) {
            writer.write(style.emptyBrackets());
        } else {
            boolean multiline = _needsOwnLines(comments)
                    || !Layout.fitsOnOneLine(writer, style.getLineLength(), _inlineItems(symbols, comments), SEPARATOR);
            if (multiline) {
                writer.writeLine("{");
                writer.indent(1);
            } else {
                writer.write(style.openingBracket());
            }

            writeItems(symbols, comments, multiline);

            if (multiline) {
                writer.dedent(1);
                writer.writeLine();
                writer.write("}");
            } else {
                writer.write(style.closingBracket());
            }
        }

        writer.write(" from " + _quote(renamedImport) + ";");
    }

    /** Paths are double-quoted unless their content contains a double quote. */
    private static String _quote(ImportDirective directive) {
        String path = directive.getPath();
        return path.contains("\"") ? "'" + path + "'" : "\"" + path + "\"";
    }

    @Override
    public void visit(ContractDefinition contract) throws IOException {
        writeDetached(contract.getDetachedComments());
        writeDocs(contract);
        writer.write(contract.getKind().getKeyword() + " " + contract.getName() + " ");

        if (!contract.getBases().isEmpty()) {
            writer.write("is");

            List<String> bases = new ArrayList<>();
            List<List<Comment>> comments = new ArrayList<>();
            for (InheritanceSpecifier base : contract.getBases()) {
                bases.add(render(base));
                comments.add(base.getComments());
            }

            boolean multiline = _needsOwnLines(comments)
                    || !Layout.fitsOnOneLine(writer, style.getLineLength(), _inlineItems(bases, comments), SEPARATOR);
            if (multiline) {
                writer.writeLine();
                writer.indent(1);
            } else {
                writer.write(" ");
            }

            writeItems(bases, comments, multiline);

            if (multiline) {
                writer.dedent(1);
                writer.writeLine();
            } else {
                writer.write(" ");
            }
        }

        List<ContractPart> parts = contract.getParts();
        if (parts.isEmpty()) {
            writer.write(style.emptyBrackets());
            return;
        }

        writer.writeLine("{");
        writer.indent(1);
        for (int i = 0; i < parts.size(); i++) {
            ContractPart part = parts.get(i);
            part.accept(this);
            Loc last = part.getLoc();

            if (_isTrailingComment(parts, i + 1)) {
                i++;
                last = writeTrailing((Comment) parts.get(i));
            }
            writer.writeLine();

            // Zero or one blank lines between members collapse to none; more collapse to one.
            if (i + 1 < parts.size() && BlankLines.separate(source, last, parts.get(i + 1).getLoc())) {
                writer.writeLine();
            }
        }
        writer.dedent(1);
        writer.write("}");
    }

    @Override
    public void visit(InheritanceSpecifier base) throws IOException {
        copySource(base.getLoc());
    }

    @Override
    public void visit(EnumDefinition enumeration) throws IOException {
        writeDetached(enumeration.getDetachedComments());
        writeDocs(enumeration);
        writer.write("enum " + enumeration.getName() + " ");

        List<String> values = enumeration.getValues();
        if (values.isEmpty()) {
            writer.write(style.emptyBrackets());
            return;
        }

        writer.writeLine("{");
        writer.indent(1);
        for (int i = 0; i < values.size(); i++) {
            writer.write(i != values.size() - 1 ? values.get(i) + "," : values.get(i));
            writeInline(enumeration.getCommentsAfter(i));
            writer.writeLine();
        }
        writer.dedent(1);
        writer.write("}");
    }

    @Override
    public void visit(FunctionDefinition function) throws IOException {
        writeDocs(function);

        if (function.getKind() == FunctionKind.CONSTRUCTOR) {
            // Constructor ranges may run up to the body and include the whitespace before it.
            writer.beginCapture();
            copySource(function.getSignature());
            writer.write(writer.endCapture().stripTrailing());
        } else {
            copySource(function.getSignature());
        }

        if (function.hasBody()) {
            if (writeInline(function.getDetachedComments())) {
                writer.writeLine();
            } else {
                writer.write(" ");
            }
            function.getBody().accept(this);
        } else {
            writer.write(";");
            writeInline(function.getDetachedComments());
        }
    }

    @Override
    public void visit(Block block) throws IOException {
        copySource(block.getLoc());
    }

    @Override
    public void visit(VariableDefinition variable) throws IOException {
        writeDocs(variable);
        copySource(variable.getDeclaration());
        writer.write(";");
        writeInline(variable.getDetachedComments());
    }

    @Override
    public void visit(OpaqueDefinition definition) throws IOException {
        writeDocs(definition);
        copySource(definition.getDeclaration());
        if (definition.isTerminated()) {
            writer.write(";");
        }
        writeInline(definition.getDetachedComments());
    }

    @Override
    public void visit(DocComment docComment) throws IOException {
        String value = docComment.getValue();
        writer.write("/// @" + docComment.getTag() + (value.isEmpty() ? "" : " " + value));
    }

    /**
     * Writes a comment verbatim. Continuation lines of a block comment are shifted by the
     * difference between the current level and the column the comment started at; whatever
     * indentation they had beyond that column is kept.
     */
    @Override
    public void visit(Comment comment) throws IOException {
        String[] lines = comment.getText().split("\n", -1);
        writer.write(lines[0].stripTrailing());
        if (lines.length == 1) {
            return;
        }

        int originalIndent = source.columnOf(comment.getLoc().getStart()) - 1;
        for (int i = 1; i < lines.length; i++) {
            writer.writeLine();
            writer.write(_removeIndent(lines[i], originalIndent).stripTrailing());
        }
    }

    /** Removes at most {@code width} leading whitespace characters. */
    private static String _removeIndent(String line, int width) {
        int i = 0;
        while (i < width && i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return line.substring(i);
    }

    /** Writes comments moved out of a rebuilt construct, each on its own line. */
    private void writeDetached(List<Comment> comments) throws IOException {
        for (Comment comment : comments) {
            comment.accept(this);
            writer.writeLine();
        }
    }

    /**
     * Writes comments after the text on the current line. A line comment ends the line, so a
     * comment after it starts a new one.
     *
     * @return whether the last comment written was a line comment
     */
    private boolean writeInline(List<Comment> comments) throws IOException {
        boolean lineComment = false;
        for (Comment comment : comments) {
            if (lineComment) {
                writer.writeLine();
            } else {
                writer.write(" ");
            }
            comment.accept(this);
            lineComment = !comment.isBlock();
        }
        return lineComment;
    }

    /**
     * Writes list items and the comments that follow them. On one line a comment stays before the
     * separator; with one item per line it goes after it.
     */
    private void writeItems(List<String> items, List<List<Comment>> comments, boolean multiline)
            throws IOException {
        if (!multiline || !_hasComments(comments)) {
            Layout.writeSeparated(writer, _inlineItems(items, comments), SEPARATOR, multiline);
            return;
        }

        String terminator = SEPARATOR.stripTrailing();
        for (int i = 0; i < items.size(); i++) {
            boolean last = i == items.size() - 1;
            writer.write(last ? items.get(i) : items.get(i) + terminator);
            writeInline(comments.get(i));
            if (!last) {
                writer.writeLine();
            }
        }
    }

    private static List<String> _inlineItems(List<String> items, List<List<Comment>> comments) {
        List<String> inline = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            StringBuilder item = new StringBuilder(items.get(i));
            for (Comment comment : comments.get(i)) {
                item.append(' ').append(comment.getText());
            }
            inline.add(item.toString());
        }
        return inline;
    }

    private static boolean _hasComments(List<List<Comment>> comments) {
        for (List<Comment> itemComments : comments) {
            if (!itemComments.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /** Line comments and multi-line block comments cannot sit inside a one-line list. */
    private static boolean _needsOwnLines(List<List<Comment>> comments) {
        for (List<Comment> itemComments : comments) {
            for (Comment comment : itemComments) {
                if (!comment.isBlock() || comment.getText().indexOf('\n') >= 0) {
                    return true;
                }
            }
        }
        return false;
    }

    private void writeDocs(Declaration declaration) throws IOException {
        for (DocComment doc : declaration.getDocs()) {
            doc.accept(this);
            writer.writeLine();
        }
    }

    /** Renders {@code node} into a string without emitting it. */
    private String render(Node node) throws IOException {
        writer.beginCapture();
        node.accept(this);
        return writer.endCapture();
    }

    /** Reproduces the original bytes of {@code loc}. */
    private void copySource(Loc loc) throws IOException {
        writer.write(source.text(loc));
    }
}
