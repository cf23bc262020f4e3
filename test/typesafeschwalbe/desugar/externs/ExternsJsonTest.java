package typesafeschwalbe.desugar.externs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static typesafeschwalbe.desugar.Trees.fixity;
import static typesafeschwalbe.desugar.Trees.module;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import typesafeschwalbe.desugar.ast.Fixity;
import typesafeschwalbe.desugar.ast.FixityAlias;
import typesafeschwalbe.desugar.ast.QualifiedName;

class ExternsJsonTest {

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(ExternsJsonTest.class.getResource(name).toURI());
    }

    @Test
    void read_loadsFixitiesAndAliases() throws Exception {
        ExternsFile externs = ExternsJson.read(
            resource("/externs/Data.List.json")
        );

        assertThat(externs.moduleName).isEqualTo("Data.List");
        assertThat(externs.fixities).hasSize(3);
        ExternsFixity cons = externs.fixities.get(0);
        assertThat(cons.associativity).isEqualTo("infixr");
        assertThat(cons.precedence).isEqualTo(6);
        assertThat(cons.operator).isEqualTo(":");
        assertThat(cons.alias.kind).isEqualTo("constructor");
        assertThat(cons.alias.name).isEqualTo("Cons");
        assertThat(externs.fixities.get(2).operator).isEqualTo("\\\\");
        assertThat(externs.fixities.get(2).alias).isNull();
    }

    @Test
    void read_rejectsUnknownAssociativity() {
        String json = "{\"moduleName\": \"M\", \"fixities\": [{"
            + "\"associativity\": \"infixq\", \"precedence\": 1,"
            + " \"operator\": \"+\"}]}";

        assertThatThrownBy(() -> ExternsJson.read(new StringReader(json)))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("infixq");
    }

    @Test
    void read_rejectsIncompleteAlias() {
        String json = "{\"moduleName\": \"M\", \"fixities\": [{"
            + "\"associativity\": \"infixl\", \"precedence\": 1,"
            + " \"operator\": \"+\", \"alias\": {\"kind\": \"value\"}}]}";

        assertThatThrownBy(() -> ExternsJson.read(new StringReader(json)))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("alias");
    }

    @Test
    void read_rejectsMissingPrecedence() {
        String json = "{\"moduleName\": \"M\", \"fixities\": [{"
            + "\"associativity\": \"infixl\", \"operator\": \"+\"}]}";

        assertThatThrownBy(() -> ExternsJson.read(new StringReader(json)))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("precedence");
    }

    @Test
    void read_rejectsMissingFixities() {
        assertThatThrownBy(() -> ExternsJson.read(
            new StringReader("{\"moduleName\": \"M\"}")
        )).isInstanceOf(IOException.class)
            .hasMessageContaining("no fixities");
    }

    @Test
    void read_rejectsEmptyOperator() {
        String json = "{\"moduleName\": \"M\", \"fixities\": [{"
            + "\"associativity\": \"infixl\", \"precedence\": 1,"
            + " \"operator\": \"\"}]}";

        assertThatThrownBy(() -> ExternsJson.read(new StringReader(json)))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("without operator");
    }

    @Test
    void read_rejectsMissingModuleName() {
        assertThatThrownBy(() -> ExternsJson.read(
            new StringReader("{\"fixities\": []}")
        )).isInstanceOf(IOException.class);
    }

    @Test
    void read_wrapsMalformedJson() {
        assertThatThrownBy(() -> ExternsJson.read(
            new StringReader("{\"moduleName\": [")
        )).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> ExternsJson.read(new StringReader("")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void write_producesReadableExterns(@TempDir Path directory)
        throws IOException {
        ExternsFile externs = ExternsConverter.fromModule(module(
            fixity(Fixity.Associativity.RIGHT, 6, ":", FixityAlias.constructor(
                QualifiedName.unqualified("Cons")
            )),
            fixity(Fixity.Associativity.NONE, 4, "==")
        ));
        Path path = directory.resolve("output").resolve("Test.Main.json");

        ExternsJson.write(externs, path);
        ExternsFile read = ExternsJson.read(path);

        assertThat(read.moduleName).isEqualTo("Test.Main");
        assertThat(read.fixities).hasSize(2);
        assertThat(read.fixities.get(0).alias.module).isEqualTo("Test.Main");
        assertThat(read.fixities.get(1).associativity).isEqualTo("infix");
    }

    @Test
    void write_isPrettyPrinted() throws IOException {
        ExternsFile externs = new ExternsFile();
        externs.moduleName = "Empty";
        externs.fixities = List.of();
        StringWriter output = new StringWriter();

        ExternsJson.write(externs, output);

        assertThat(output.toString())
            .contains("\"moduleName\": \"Empty\"")
            .contains("\n");
    }

}
