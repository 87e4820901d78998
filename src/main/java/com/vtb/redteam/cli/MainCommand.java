package com.vtb.redteam.cli;

import com.vtb.redteam.config.RedTeamConfig;
import com.vtb.redteam.core.AttackOrchestrator;
import com.vtb.redteam.core.InvalidConfigurationException;
import com.vtb.redteam.core.RunListener;
import com.vtb.redteam.detection.DetectionEngine;
import com.vtb.redteam.detection.ToxicityVerdict;
import com.vtb.redteam.models.Attack;
import com.vtb.redteam.models.AttackCategory;
import com.vtb.redteam.models.AttackOutcome;
import com.vtb.redteam.models.Intensity;
import com.vtb.redteam.models.TestReport;
import com.vtb.redteam.payload.PayloadCatalog;
import com.vtb.redteam.registry.CategoryRegistry;
import com.vtb.redteam.reports.JsonReportGenerator;
import com.vtb.redteam.target.ChatCompletionsTargetAdapter;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда red-team сканера диалоговых моделей
 */
@Slf4j
@Command(
    name = "llm-redteam",
    mixinStandardHelpOptions = true,
    version = "VTB LLM Red-Team Scanner 1.0.0",
    description = """

        VTB LLM Red-Team Scanner

        Автоматизированное состязательное тестирование диалоговых моделей

        Возможности:
          • Prompt injection, jailbreak, провокация токсичности, fuzzing поведения
          • Оценка ответов и интегральный риск 0..100
          • Рекомендации по устранению
          • JSON отчет и exit codes для CI/CD

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_RISK_ABOVE_LIMIT = 2;

    @Option(
        names = {"-s", "--system-prompt"},
        description = "Системный промпт / контекст тестируемой модели"
    )
    private String systemPrompt;

    @Option(
        names = {"--system-prompt-file"},
        description = "Файл с системным промптом (вместо --system-prompt)"
    )
    private Path systemPromptFile;

    @Option(
        names = {"-c", "--category"},
        description = "Категория атак: prompt_injection, jailbreak, toxic_output, behavior_fuzzing "
            + "(можно указать несколько раз, по умолчанию все)"
    )
    private List<String> categories = new ArrayList<>();

    @Option(
        names = {"-i", "--intensity"},
        description = "Интенсивность: low, medium, high (по умолчанию: medium)"
    )
    private String intensity = "medium";

    @Option(
        names = {"--concurrency"},
        description = "Число параллельных вызовов цели (по умолчанию из конфигурации)"
    )
    private Integer concurrency;

    @Option(
        names = {"--run-timeout"},
        description = "Общий таймаут прогона в секундах (по умолчанию из конфигурации)"
    )
    private Integer runTimeoutSec;

    @Option(
        names = {"-e", "--endpoint"},
        description = "URL OpenAI-совместимого эндпоинта /chat/completions"
    )
    private String endpoint;

    @Option(
        names = {"-m", "--model"},
        description = "Имя модели в запросе"
    )
    private String model;

    @Option(
        names = {"--api-key"},
        description = "API ключ (по умолчанию из REDTEAM_API_KEY)",
        defaultValue = "${env:REDTEAM_API_KEY}"
    )
    private String apiKey;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию: ./reports)"
    )
    private String outputDir = "./reports";

    @Option(
        names = {"--fail-above"},
        description = "Завершиться с кодом 2, если риск выше порога (для CI/CD)"
    )
    private Double failAbove;

    @Option(
        names = {"--generate-only"},
        description = "Только сгенерировать нагрузки, без обращения к цели"
    )
    private boolean generateOnly = false;

    @Option(
        names = {"--count"},
        description = "Сколько нагрузок на категорию в режиме --generate-only (по умолчанию: 10)"
    )
    private int count = 10;

    @Option(
        names = {"--check-toxicity"},
        description = "Проверить произвольный текст на токсичность и выйти"
    )
    private String toxicityText;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            RedTeamConfig config = RedTeamConfig.load();
            JsonReportGenerator json = new JsonReportGenerator();

            if (toxicityText != null) {
                return checkToxicity(config, json);
            }
            if (generateOnly) {
                return generatePayloads(config, json);
            }
            return runTest(config, json);
        } catch (InvalidConfigurationException e) {
            log.error("Некорректная конфигурация: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (Exception e) {
            log.error("Ошибка при тестировании: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    private int checkToxicity(RedTeamConfig config, JsonReportGenerator json) throws Exception {
        DetectionEngine engine = new DetectionEngine(CategoryRegistry.defaults(config),
            config.getDetection().getNearMissMargin());
        ToxicityVerdict verdict = engine.analyzeToxicity(toxicityText);
        System.out.println(json.toJson(verdict));
        return EXIT_OK;
    }

    private int generatePayloads(RedTeamConfig config, JsonReportGenerator json) throws Exception {
        PayloadCatalog catalog = new PayloadCatalog(CategoryRegistry.defaults(config), config.getCatalog());
        Intensity level = Intensity.fromValue(intensity);
        List<Attack> attacks = new ArrayList<>();
        for (AttackCategory category : resolveCategories()) {
            attacks.addAll(catalog.generate(category, level, count));
        }
        System.out.println(json.toJson(attacks));
        return EXIT_OK;
    }

    private int runTest(RedTeamConfig config, JsonReportGenerator json) throws Exception {
        if (endpoint == null || endpoint.isBlank()) {
            throw new InvalidConfigurationException("Не указан --endpoint");
        }
        if (!endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
            throw new InvalidConfigurationException("Endpoint должен начинаться с http:// или https://");
        }
        String targetContext = resolveSystemPrompt();
        Set<AttackCategory> selected = resolveCategories();
        Intensity level = Intensity.fromValue(intensity);

        ChatCompletionsTargetAdapter target = new ChatCompletionsTargetAdapter(endpoint, model, apiKey);
        AttackOrchestrator orchestrator = AttackOrchestrator.create(config, target, new ProgressListener());

        int concurrencyLimit = concurrency != null ? concurrency : config.getOrchestrator().getConcurrencyLimit();
        Duration runTimeout = Duration.ofSeconds(runTimeoutSec != null
            ? runTimeoutSec
            : config.getOrchestrator().getRunTimeoutSec());

        TestReport report = orchestrator.runTest(targetContext, selected, level, concurrencyLimit, runTimeout);

        Path outputPath = Path.of(outputDir).resolve("redteam-report-" + report.getTestId() + "."
            + json.getFileExtension());
        json.generate(report, outputPath);
        printResults(report);

        if (failAbove != null && report.getRiskScore() > failAbove) {
            log.error("Риск {} выше порога {} (--fail-above)", report.getRiskScore(), failAbove);
            return EXIT_RISK_ABOVE_LIMIT;
        }
        return EXIT_OK;
    }

    Set<AttackCategory> resolveCategories() {
        if (categories == null || categories.isEmpty()) {
            return EnumSet.allOf(AttackCategory.class);
        }
        Set<AttackCategory> selected = EnumSet.noneOf(AttackCategory.class);
        for (String raw : categories) {
            for (String part : raw.split(",")) {
                selected.add(AttackCategory.fromValue(part));
            }
        }
        return selected;
    }

    private String resolveSystemPrompt() throws IOException {
        if (systemPromptFile != null) {
            return Files.readString(systemPromptFile);
        }
        return systemPrompt != null ? systemPrompt : "";
    }

    private void printResults(TestReport report) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("VTB LLM RED-TEAM REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.println("Прогон: " + report.getTestId());
        System.out.println("Начало: " + report.getStartTime());
        System.out.println("Конец:  " + report.getEndTime());
        System.out.println();
        System.out.println("Всего атак:     " + report.getTotalAttacks());
        System.out.println("Успешных атак:  " + report.getSuccessfulAttacks());
        System.out.println("Итоговый риск:  " + report.getRiskScore() + "/100");
        System.out.println();

        long errors = report.getOutcomes().stream().filter(AttackOutcome::hasError).count();
        if (errors > 0) {
            System.out.println("Атак с ошибками: " + errors);
            System.out.println();
        }

        if (report.hasVulnerabilities()) {
            System.out.println("УЯЗВИМОСТИ:");
            int limit = Math.min(5, report.getVulnerabilitiesFound().size());
            for (int i = 0; i < limit; i++) {
                AttackOutcome v = report.getVulnerabilitiesFound().get(i);
                System.out.printf("   #%d [%s] %s / %s, score=%.2f%n",
                    i + 1, v.getSeverity().getRussianName(), v.getCategory().getValue(),
                    v.getTechniqueTag(), v.getDetectionScore());
            }
            System.out.println();
        }

        System.out.println("Рекомендации:");
        report.getRecommendations().forEach(r -> System.out.println("   - " + r));
        System.out.println("=".repeat(80));
    }

    /**
     * Прогресс прогона в лог
     */
    private static class ProgressListener implements RunListener {
        @Override
        public void onOutcome(String testId, AttackOutcome outcome) {
            if (outcome.isSucceeded()) {
                log.info("[{}] атака {} ({}) успешна, score={}",
                    testId, outcome.getAttackId(), outcome.getTechniqueTag(), outcome.getDetectionScore());
            }
        }
    }
}
