package com.ryuqq.provisioner.adapter.aws.function;

import com.ryuqq.provisioner.core.exception.ErrorCategory;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FunctionArchive tests.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class FunctionArchiveTest {

    @TempDir
    Path tempDir;

    @Test
    void zip_PackagesSourceAsHandlerModule() throws Exception {
        // given
        Path source = tempDir.resolve("handler.py");
        Files.writeString(source, "def lambda_handler(event, context):\n    return 1\n");

        // when
        byte[] archive = FunctionArchive.zip(source);

        // then
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry = zip.getNextEntry();
            assertThat(entry).isNotNull();
            assertThat(entry.getName()).isEqualTo("lambda_function.py");
            assertThat(new String(zip.readAllBytes(), StandardCharsets.UTF_8)).contains("lambda_handler");
            assertThat(zip.getNextEntry()).isNull();
        }
    }

    @Test
    void zip_MissingSource_ThrowsFatal() {
        Path missing = tempDir.resolve("absent.py");

        assertThatThrownBy(() -> FunctionArchive.zip(missing))
            .isInstanceOf(ProvisioningException.class)
            .hasMessageContaining("Function source not found")
            .satisfies(e -> assertThat(((ProvisioningException) e).getCategory()).isEqualTo(ErrorCategory.FATAL));
    }
}
