package me.golemcore.kanban.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.kanban.domain.model.Stage;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code "Stage: <name>"} convention workflows use in their
 * current-step text.
 *
 * <p>
 * Grammar: optional leading whitespace, the token {@code Stage} (any case), a
 * colon, optional whitespace, then a word. Only the five workflow stages are
 * accepted as inference targets.
 */
public final class StageHintParser {

    private static final Pattern STAGE_HINT = Pattern.compile("^\\s*Stage:\\s*(\\w+)", Pattern.CASE_INSENSITIVE);

    private StageHintParser() {
    }

    /**
     * The lower-cased word after {@code Stage:}, whether or not it names a
     * known stage.
     */
    public static Optional<String> parseHint(String currentStep) {
        if (currentStep == null || currentStep.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = STAGE_HINT.matcher(currentStep);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1).toLowerCase(Locale.ROOT));
    }

    /**
     * The hinted stage, only if it is one of plan, build, test, review or
     * document.
     */
    public static Optional<Stage> parseStage(String currentStep) {
        return parseHint(currentStep)
                .flatMap(Stage::parse)
                .filter(Stage::isWorkflowStage);
    }
}
