package com.iimsoft.vrpvalidator.app;

import com.iimsoft.vrpvalidator.api.dto.ProblemRequest;
import com.iimsoft.vrpvalidator.api.dto.ValidationResponse;
import com.iimsoft.vrpvalidator.service.ProblemReadException;
import com.iimsoft.vrpvalidator.service.ProblemValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 命令行入口：读取问题定义 JSON，输出校验结果 JSON。
 *
 * 用法：
 * - 读取文件：mvn exec:java -Dexec.args=path/to/problem.json
 * - 读取 stdin：mvn exec:java -Dexec.args=- < problem.json
 *
 * 退出码：0 校验通过；1 发现错误；2 参数或读取失败。
 */
public class ProblemValidatorApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProblemValidatorApp.class);

    public static void main(String[] args) throws Exception {
        System.exit(run(args));
    }

    static int run(String[] args) throws Exception {
        if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
            System.err.println("Missing argument: problem JSON file path, or '-' to read from stdin.\n" +
                    "Example: mvn exec:java -Dexec.args=problem.json");
            return 2;
        }

        ProblemValidationService service = new ProblemValidationService();

        ProblemRequest request;
        String input = args[0].trim();
        try {
            if ("-".equals(input)) {
                try (InputStream in = System.in) {
                    request = service.readRequest(in);
                }
            } else {
                Path path = Path.of(input);
                if (!Files.exists(path) || Files.isDirectory(path)) {
                    System.err.println("Problem file does not exist or is a directory: " + path.toAbsolutePath());
                    return 2;
                }
                request = service.readRequest(path);
            }
        } catch (ProblemReadException e) {
            LOGGER.error("Cannot read problem definition", e);
            return 2;
        }

        ValidationResponse response = service.validate(request);
        String json = service.getMapper().writerWithDefaultPrettyPrinter().writeValueAsString(response);
        System.out.println(json);
        return response.valid ? 0 : 1;
    }
}
