package typesafeschwalbe.desugar.externs;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import typesafeschwalbe.desugar.ast.Fixity;

public final class ExternsJson {

    private static final Logger LOGGER
        = LoggerFactory.getLogger(ExternsJson.class);

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    private ExternsJson() {}

    public static ExternsFile read(Path path) throws IOException {
        try(Reader reader = Files.newBufferedReader(
            path, StandardCharsets.UTF_8
        )) {
            ExternsFile externs = ExternsJson.read(reader);
            LOGGER.debug(
                "Read {} fixities of module {} from {}",
                externs.fixities.size(), externs.moduleName, path
            );
            return externs;
        }
    }

    public static ExternsFile read(Reader reader) throws IOException {
        ExternsFile externs;
        try {
            externs = GSON.fromJson(reader, ExternsFile.class);
        } catch(JsonParseException e) {
            throw new IOException(
                "Malformed externs file: " + e.getMessage(), e
            );
        }
        if(externs == null) {
            throw new IOException("Empty externs file");
        }
        ExternsJson.validate(externs);
        return externs;
    }

    public static void write(
        ExternsFile externs, Writer writer
    ) throws IOException {
        try {
            GSON.toJson(externs, writer);
        } catch(JsonParseException e) {
            throw new IOException(
                "Unable to write externs of module " + externs.moduleName, e
            );
        }
    }

    public static void write(ExternsFile externs, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if(parent != null) {
            Files.createDirectories(parent);
        }
        try(Writer writer = Files.newBufferedWriter(
            path, StandardCharsets.UTF_8
        )) {
            ExternsJson.write(externs, writer);
        }
        LOGGER.debug("Wrote externs of module {} to {}", externs.moduleName, path);
    }

    private static void validate(ExternsFile externs) throws IOException {
        if(externs.moduleName == null || externs.moduleName.isEmpty()) {
            throw new IOException("Externs file has no module name");
        }
        if(externs.fixities == null) {
            throw new IOException(
                "Externs of module " + externs.moduleName + " have no fixities"
            );
        }
        for(ExternsFixity fixity: externs.fixities) {
            if(fixity == null || fixity.operator == null
                || fixity.operator.isEmpty()) {
                throw new IOException(
                    "Fixity without operator in externs of module "
                        + externs.moduleName
                );
            }
            try {
                Fixity.Associativity.fromKeyword(fixity.associativity);
            } catch(IllegalArgumentException e) {
                throw new IOException(
                    "Invalid fixity of operator " + fixity.operator
                        + " in externs of module " + externs.moduleName
                        + ": " + e.getMessage(),
                    e
                );
            }
            if(fixity.precedence == null) {
                throw new IOException(
                    "Missing precedence of operator " + fixity.operator
                        + " in externs of module " + externs.moduleName
                );
            }
            if(fixity.alias != null) {
                ExternsJson.validateAlias(externs, fixity);
            }
        }
    }

    private static void validateAlias(
        ExternsFile externs, ExternsFixity fixity
    ) throws IOException {
        ExternsAlias alias = fixity.alias;
        boolean knownKind = "value".equals(alias.kind)
            || "constructor".equals(alias.kind);
        boolean named = alias.module != null && !alias.module.isEmpty()
            && alias.name != null && !alias.name.isEmpty();
        if(!knownKind || !named) {
            throw new IOException(
                "Invalid alias of operator " + fixity.operator
                    + " in externs of module " + externs.moduleName
            );
        }
    }

}
