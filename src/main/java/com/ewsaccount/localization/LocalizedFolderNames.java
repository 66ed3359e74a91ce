package com.ewsaccount.localization;

import com.ewsaccount.domain.FolderType;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in localized folder names, optionally extended from configuration.
 * <p>
 * Administrators can rename default folders into a locale (Set-MailboxRegionalConfiguration
 * -LocalizeDefaultFolderName), so the list is neither complete nor authoritative.
 * Recoverable-items folders are never localized and have no entries.
 */
@Slf4j
public class LocalizedFolderNames implements LocalizationTable {

    // locale -> type -> names
    private final Map<String, Map<FolderType, Set<String>>> names = new HashMap<>();

    public LocalizedFolderNames() {
        add(FolderType.CALENDAR,
                "da_DK", "Kalender", "de_DE", "Kalender", "en_US", "Calendar", "es_ES", "Calendario",
                "fr_CA", "Calendrier", "nl_NL", "Agenda", "ru_RU", "Календарь", "sv_SE", "Kalender",
                "zh_CN", "日历");
        add(FolderType.DELETED_ITEMS,
                "da_DK", "Slettet post", "de_DE", "Gelöschte Elemente", "en_US", "Deleted Items",
                "es_ES", "Elementos eliminados", "fr_CA", "Éléments supprimés", "nl_NL", "Verwijderde items",
                "ru_RU", "Удаленные", "sv_SE", "Borttaget", "zh_CN", "已删除邮件");
        add(FolderType.DRAFTS,
                "da_DK", "Kladder", "de_DE", "Entwürfe", "en_US", "Drafts", "es_ES", "Borradores",
                "fr_CA", "Brouillons", "nl_NL", "Concepten", "ru_RU", "Черновики", "sv_SE", "Utkast",
                "zh_CN", "草稿");
        add(FolderType.INBOX,
                "da_DK", "Indbakke", "de_DE", "Posteingang", "en_US", "Inbox", "es_ES", "Bandeja de entrada",
                "fr_CA", "Boîte de réception", "nl_NL", "Postvak IN", "ru_RU", "Входящие", "sv_SE", "Inkorgen",
                "zh_CN", "收件箱");
        add(FolderType.OUTBOX,
                "da_DK", "Udbakke", "de_DE", "Postausgang", "en_US", "Outbox", "es_ES", "Bandeja de salida",
                "fr_CA", "Boîte d'envoi", "nl_NL", "Postvak UIT", "ru_RU", "Исходящие", "sv_SE", "Utkorgen",
                "zh_CN", "发件箱");
        add(FolderType.SENT_ITEMS,
                "da_DK", "Sendt post", "de_DE", "Gesendete Elemente", "en_US", "Sent Items",
                "es_ES", "Elementos enviados", "fr_CA", "Éléments envoyés", "nl_NL", "Verzonden items",
                "ru_RU", "Отправленные", "sv_SE", "Skickat", "zh_CN", "已发送邮件");
        add(FolderType.JUNK_EMAIL,
                "da_DK", "Uønsket e-mail", "de_DE", "Junk-E-Mail", "en_US", "Junk E-mail",
                "es_ES", "Correo no deseado", "fr_CA", "Courrier indésirables", "nl_NL", "Ongewenste e-mail",
                "ru_RU", "Нежелательная почта", "sv_SE", "Skräppost", "zh_CN", "垃圾邮件");
        add(FolderType.TASKS,
                "da_DK", "Opgaver", "de_DE", "Aufgaben", "en_US", "Tasks", "es_ES", "Tareas",
                "fr_CA", "Tâches", "nl_NL", "Taken", "ru_RU", "Задачи", "sv_SE", "Uppgifter", "zh_CN", "任务");
        add(FolderType.CONTACTS,
                "da_DK", "Kontaktpersoner", "de_DE", "Kontakte", "en_US", "Contacts", "es_ES", "Contactos",
                "fr_CA", "Contacts", "nl_NL", "Contactpersonen", "ru_RU", "Контакты", "sv_SE", "Kontakter",
                "zh_CN", "联系人");
    }

    /**
     * Extend the built-in table. Configured names are added to, not substituted for, the built-in ones.
     *
     * @param overrides locale -> type -> names
     */
    public LocalizedFolderNames(Map<String, Map<FolderType, List<String>>> overrides) {
        this();
        if (overrides == null) {
            return;
        }
        overrides.forEach((locale, byType) -> byType.forEach((type, list) -> {
            for (String name : list) {
                entry(locale, type).add(name);
            }
            log.debug("Localized {} names for {}: {}", type, locale, list);
        }));
    }

    @Override
    public Set<String> namesFor(FolderType type, String locale) {
        Map<FolderType, Set<String>> byType = names.get(locale);
        if (byType == null) {
            return Collections.emptySet();
        }
        Set<String> result = byType.get(type);
        return result == null ? Collections.emptySet() : Collections.unmodifiableSet(result);
    }

    private void add(FolderType type, String... localeNamePairs) {
        for (int i = 0; i < localeNamePairs.length; i += 2) {
            entry(localeNamePairs[i], type).add(localeNamePairs[i + 1]);
        }
    }

    private Set<String> entry(String locale, FolderType type) {
        return names.computeIfAbsent(locale, k -> new EnumMap<>(FolderType.class))
                .computeIfAbsent(type, k -> new LinkedHashSet<>());
    }
}
