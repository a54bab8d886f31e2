package com.archebuild.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ValidateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void validate_bundledDatabase_succeeds() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "validate");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("✓ 51 type elements");
    }

    @Test
    void validate_unknownMaterial_fails() throws IOException {
        TestData.writeBrokenDatabase(tempDir);

        CliTestSupport.Result result = CliTestSupport.run("-q", "validate",
            "--type-elements", tempDir.resolve("TypeElements.json").toString(),
            "--materials", tempDir.resolve("MaterialTemplates.json").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out())
            .contains("[ERROR] OuterWall_iwu_heavy_0_1976")
            .contains("unknown material 'brick'");
    }

    @Test
    void validate_missingFile_fails() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "validate",
            "--type-elements", tempDir.resolve("missing.json").toString(),
            "--materials", tempDir.resolve("missing-materials.json").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Could not load database");
    }
}
