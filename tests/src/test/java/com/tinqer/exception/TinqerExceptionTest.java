package com.tinqer.exception;

import com.tinqer.plan.Tinqer;
import com.tinqer.schema.DatabaseSchema;
import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@TestCategories.Unit
@TestCategories.Tier2
@DisplayName("TinqerException")
public class TinqerExceptionTest extends TestBase {

    @Nested
    @DisplayName("ErrorContext")
    class Context {

        @Test
        @DisplayName("toString lists the known parts")
        void testToString() {
            assertThat(ErrorContext.of("select", "users", "where"))
                .hasToString("operation=select, table=users, method=where");
            assertThat(ErrorContext.method("take")).hasToString("method=take");
            assertThat(ErrorContext.EMPTY.isEmpty()).isTrue();
            assertThat(ErrorContext.EMPTY).hasToString("");
        }

        @Test
        @DisplayName("with* copies change one part")
        void testWithers() {
            ErrorContext context = ErrorContext.method("set").withOperationKind("update").withTable("users");

            assertThat(context).isEqualTo(ErrorContext.of("update", "users", "set"));
            assertThat(context.withMethod("where").method()).isEqualTo("where");
            assertThat(context.method()).isEqualTo("set");
        }
    }

    @Test
    @DisplayName("User message includes category and context")
    void testUserMessage() {
        SemanticPolicyException withContext = new SemanticPolicyException("boom", ErrorContext.of("delete", "users", null));
        ParseStructureException withoutContext = new ParseStructureException("bad");

        assertThat(withContext.getUserMessage()).isEqualTo("Unsafe query (operation=delete, table=users): boom");
        assertThat(withoutContext.getUserMessage()).isEqualTo("Query structure error: bad");
        assertThat(withoutContext.getContext()).isSameAs(ErrorContext.EMPTY);
    }

    @Test
    @DisplayName("Technical message lists every known field and the cause")
    void testTechnicalMessage() {
        PolicyBindingException e = new PolicyBindingException("missing", new IllegalStateException("root"),
            ErrorContext.of("select", "posts", null));

        String message = e.getTechnicalMessage();

        assertThat(message).startsWith("Row filter binding error\n")
            .contains("Error: missing\n")
            .contains("Operation: select\n")
            .contains("Table: posts\n")
            .contains("Cause: root\n")
            .doesNotContain("Method:");
        assertThat(e.getOperationKind()).isEqualTo("select");
        assertThat(e.getTable()).isEqualTo("posts");
        assertThat(e.getMethod()).isNull();
    }

    @Test
    @DisplayName("Compiler failures are TinqerExceptions with a category")
    void testCompilerFailure() {
        DialectCapabilityException e = catchThrowableOfType(() -> sqlite(
            Tinqer.insertInto(DatabaseSchema.create(), "users").values(Map.of("a", 1)).returning("u => u.id")),
            DialectCapabilityException.class);

        logData("User message", e.getUserMessage());
        assertThat(e).isInstanceOf(TinqerException.class);
        assertThat(e.getUserMessage()).startsWith("Unsupported by dialect (operation=insert, table=users, method=returning)");
    }
}
