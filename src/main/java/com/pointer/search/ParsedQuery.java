package com.pointer.search;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public record ParsedQuery(
        List<String> terms,
        List<String> excludedTerms,
        List<String> repositories,
        List<String> excludedRepositories,
        List<String> fileGlobs,
        List<String> excludedFileGlobs,
        List<String> languages,
        List<String> excludedLanguages,
        CaseMode caseMode) {

    public enum CaseMode {
        YES,
        NO,
        AUTO
    }

    public boolean caseSensitive(boolean requestDefault) {
        return switch (caseMode) {
            case YES -> true;
            case NO -> false;
            case AUTO -> requestDefault || terms.stream().anyMatch(term -> !term.equals(term.toLowerCase(Locale.ROOT)));
        };
    }

    public boolean acceptsRepository(String repository) {
        if (!repositories.isEmpty() && !repositories.contains(repository)) {
            return false;
        }
        return !excludedRepositories.contains(repository);
    }

    public boolean acceptsLanguage(String language) {
        if (!languages.isEmpty() && (language == null || languages.stream().noneMatch(language::equalsIgnoreCase))) {
            return false;
        }
        return language == null || excludedLanguages.stream().noneMatch(language::equalsIgnoreCase);
    }

    public boolean acceptsPath(String path) {
        if (!fileGlobs.isEmpty() && fileGlobs.stream().noneMatch(glob -> pathMatches(glob, path))) {
            return false;
        }
        return excludedFileGlobs.stream().noneMatch(glob -> pathMatches(glob, path));
    }

    // no wildcard means substring; * and ? stay inside one segment, ** crosses segments
    static boolean pathMatches(String glob, String path) {
        if (glob.indexOf('*') < 0 && glob.indexOf('?') < 0) {
            return path.contains(glob);
        }
        return Pattern.compile(globToRegex(glob)).matcher(path).matches();
    }

    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i++;
                } else {
                    regex.append("[^/]*");
                }
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
