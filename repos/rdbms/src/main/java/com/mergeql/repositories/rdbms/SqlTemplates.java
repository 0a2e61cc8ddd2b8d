package com.mergeql.repositories.rdbms;

import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Template;
import com.mergeql.core.MergeStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

import static com.tailoredshapes.underbar.ocho.Die.rethrow;

/**
 * The statements the merge engine issues, as Handlebars templates over quoted identifiers.
 */
public record SqlTemplates(
        Template relink,
        Template relinkRow,
        Template select,
        Template deleteRow,
        Template deleteIn,
        Template relinkPolymorphic,
        Template updateRecord,
        Template updateIn,
        Template insertLink,
        Template parentOf
) {
    private static final Logger logger = LoggerFactory.getLogger(SqlTemplates.class);

    public static SqlTemplates load() {
        Handlebars handlebars = new Handlebars();
        return new SqlTemplates(
                loadTemplate(handlebars, "sql/merge/relink.sql"),
                loadTemplate(handlebars, "sql/merge/relinkRow.sql"),
                loadTemplate(handlebars, "sql/merge/select.sql"),
                loadTemplate(handlebars, "sql/merge/deleteRow.sql"),
                loadTemplate(handlebars, "sql/merge/deleteIn.sql"),
                loadTemplate(handlebars, "sql/merge/relinkPolymorphic.sql"),
                loadTemplate(handlebars, "sql/merge/updateRecord.sql"),
                loadTemplate(handlebars, "sql/merge/updateIn.sql"),
                loadTemplate(handlebars, "sql/merge/insertLink.sql"),
                loadTemplate(handlebars, "sql/merge/parentOf.sql")
        );
    }

    public static String render(Template template, Map<String, Object> context) {
        try {
            return template.apply(context).trim();
        } catch (IOException e) {
            logger.error("Failed to render SQL template", e);
            throw new MergeStoreException("Failed to render SQL template", e);
        }
    }

    private static Template loadTemplate(Handlebars handlebars, String path) {
        try (InputStream is = SqlTemplates.class.getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new FileNotFoundException("Template not found: " + path);
            }
            try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                String templateContent = new BufferedReader(reader)
                        .lines()
                        .collect(Collectors.joining("\n"));
                return rethrow(() -> handlebars.compileInline(templateContent));
            }
        } catch (IOException e) {
            logger.error("Failed to load template: {}", path, e);
            throw new MergeStoreException("Failed to load template: " + path, e);
        }
    }
}
