package com.baykanat.metrics.core.infrastructure.directory;

import com.baykanat.metrics.core.domain.model.DirectoryUser;
import com.baykanat.metrics.core.domain.model.MembersPage;
import com.baykanat.metrics.core.domain.model.rule.EntityAttributeRule;

import java.util.Collection;
import java.util.List;

/** Salt okunur harici kullanıcı dizini. Kullanıcı id'si küçük harf email; okumalar eventual consistent. */
public interface UserDirectory {

    /** Verilen (küçük harf) email'lerden dizinde olanlar. */
    List<DirectoryUser> findByEmails(Collection<String> emails);

    /**
     * Email'e göre artan sırada sayfa.
     *
     * @param condition null ise tüm kullanıcılar, değilse attribute koşuluna uyanlar
     */
    MembersPage pageEmails(EntityAttributeRule condition, int limit, long offset);
}
