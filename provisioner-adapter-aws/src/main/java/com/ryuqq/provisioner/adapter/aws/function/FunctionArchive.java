package com.ryuqq.provisioner.adapter.aws.function;

import com.ryuqq.provisioner.core.exception.ProvisioningException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds the deployment package of a function: a zip holding the source file as
 * {@value #ENTRY_NAME}.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class FunctionArchive {

    public static final String ENTRY_NAME = "lambda_function.py";

    private FunctionArchive() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param source function source file
     * @return zip bytes
     * @throws ProvisioningException (FATAL) if the file is missing or unreadable
     */
    public static byte[] zip(Path source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (!Files.isRegularFile(source)) {
            throw ProvisioningException.fatal("Function source not found: " + source);
        }
        try {
            byte[] code = Files.readAllBytes(source);
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
                zip.putNextEntry(new ZipEntry(ENTRY_NAME));
                zip.write(code);
                zip.closeEntry();
            }
            return buffer.toByteArray();
        } catch (IOException e) {
            throw ProvisioningException.fatal("Cannot package function source " + source, e);
        }
    }
}
