package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.exception.DownloadException;
import com.phillippitts.dictation.exception.DownloadFailure;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.ModelInstallationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ModelFileValidatorTest {

    @TempDir
    Path dir;

    @Test
    void acceptsFileWithinTolerance() throws IOException {
        Path file = Files.write(dir.resolve("model.bin"), new byte[9_500]);

        assertThat(ModelFileValidator.validateSize("base", file, 10_000, 10)).isEqualTo(9_500);
        assertThat(file).exists();
    }

    @Test
    void deletesAndRejectsTruncatedFile() throws IOException {
        Path file = Files.write(dir.resolve("model.bin"), new byte[5_000]);

        ModelInstallationException e = catchThrowableOfType(
                () -> ModelFileValidator.validateSize("base", file, 10_000, 10), ModelInstallationException.class);

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CORRUPTION);
        assertThat(e.getMessage()).contains("appears corrupted").contains("base");
        assertThat(e.getCause()).isInstanceOf(DownloadException.class);
        assertThat(((DownloadException) e.getCause()).getFailure()).isEqualTo(DownloadFailure.FILE_TOO_SMALL);
        assertThat(file).doesNotExist();
    }

    @Test
    void unknownExpectedSizeSkipsCheck() throws IOException {
        Path file = Files.write(dir.resolve("model.bin"), new byte[10]);

        assertThat(ModelFileValidator.validateSize("base", file, 0, 10)).isEqualTo(10);
    }

    @Test
    void listsMissingRequiredFiles() throws IOException {
        Files.write(dir.resolve("encoder.int8.onnx"), new byte[1]);
        Files.write(dir.resolve("tokens.txt"), new byte[1]);

        List<String> missing = ModelFileValidator.missingFiles(dir,
                List.of("encoder.int8.onnx", "decoder.int8.onnx", "joiner.int8.onnx", "tokens.txt"));

        assertThat(missing).containsExactly("decoder.int8.onnx", "joiner.int8.onnx");
    }
}
