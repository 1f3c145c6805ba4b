package io.surfworks.fcc.license;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * {@link PromptProvider} that hands out queued credentials and records what it was asked.
 */
class ScriptedPrompt implements PromptProvider {

    private final Deque<Credentials> answers = new ArrayDeque<>();
    final List<String> defaultEmails = new ArrayList<>();
    final List<String> errors = new ArrayList<>();

    ScriptedPrompt answer(String key, String email) {
        answers.add(new Credentials(key, email));
        return this;
    }

    int promptCount() {
        return defaultEmails.size();
    }

    @Override
    public Optional<Credentials> prompt(String defaultEmail) {
        defaultEmails.add(defaultEmail);
        return Optional.ofNullable(answers.poll());
    }

    @Override
    public void showError(String message) {
        errors.add(message);
    }
}
