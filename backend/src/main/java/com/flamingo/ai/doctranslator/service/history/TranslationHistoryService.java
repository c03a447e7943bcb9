package com.flamingo.ai.doctranslator.service.history;

import com.flamingo.ai.doctranslator.service.history.dto.RecentTranslation;
import com.flamingo.ai.doctranslator.service.history.dto.TranslationContent;
import com.flamingo.ai.doctranslator.service.history.dto.TranslationStats;
import java.util.List;
import java.util.Optional;

/** Read-only queries over a user's translation jobs. */
public interface TranslationHistoryService {

  int DEFAULT_RECENT_LIMIT = 2;

  /**
   * Gets the user's most recently completed translations.
   *
   * @param userId the owner
   * @param limit maximum number of entries
   * @return completed translations, newest first
   */
  List<RecentTranslation> recentTranslations(String userId, int limit);

  default List<RecentTranslation> recentTranslations(String userId) {
    return recentTranslations(userId, DEFAULT_RECENT_LIMIT);
  }

  /**
   * Gets a translation with its page contents.
   *
   * @param processId the job's process id
   * @param userId the requesting user
   * @return the content, or empty if the job does not exist or belongs to another user
   */
  Optional<TranslationContent> translationContent(String processId, String userId);

  TranslationStats stats(String userId);
}
