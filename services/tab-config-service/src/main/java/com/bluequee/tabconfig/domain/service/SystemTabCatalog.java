package com.bluequee.tabconfig.domain.service;

import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.TabScope;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** The built-in patient record tabs every organization starts from. */
public final class SystemTabCatalog {

    public static final String BUILTIN_COMPONENT = "builtin_component";
    public static final String CLINICAL = "clinical";
    public static final String ADMINISTRATIVE = "administrative";

    private static final List<SystemTab> TABS =
            List.of(
                    new SystemTab("overview", "Overview", "User", CLINICAL, 10),
                    new SystemTab("visits", "Visits", "Calendar", CLINICAL, 20),
                    new SystemTab("lab", "Lab Results", "TestTube", CLINICAL, 30),
                    new SystemTab("medications", "Medications", "Pill", CLINICAL, 40),
                    new SystemTab("vitals", "Vitals", "Activity", CLINICAL, 50),
                    new SystemTab("documents", "Documents", "FileText", ADMINISTRATIVE, 60),
                    new SystemTab("billing", "Billing", "CreditCard", ADMINISTRATIVE, 70),
                    new SystemTab("insurance", "Insurance", "Shield", ADMINISTRATIVE, 80),
                    new SystemTab("appointments", "Appointments", "CalendarDays", ADMINISTRATIVE, 90),
                    new SystemTab("history", "History", "History", CLINICAL, 100),
                    new SystemTab("med-reviews", "Medication Reviews", "FileCheck", CLINICAL, 110),
                    new SystemTab("communication", "Communication", "MessageSquare", ADMINISTRATIVE, 120),
                    new SystemTab(
                            "psychological-therapy", "Psychological Therapy", "Brain", CLINICAL, 130),
                    new SystemTab("timeline", "Timeline", "Clock", CLINICAL, 140),
                    new SystemTab("immunizations", "Immunizations", "Syringe", CLINICAL, 150),
                    new SystemTab("safety", "Safety Alerts", "Shield", CLINICAL, 160),
                    new SystemTab("allergies", "Allergies", "AlertTriangle", CLINICAL, 170),
                    new SystemTab("imaging", "Imaging", "Scan", CLINICAL, 180),
                    new SystemTab("procedures", "Procedures", "Scissors", CLINICAL, 190),
                    new SystemTab("referrals", "Referrals", "Users", CLINICAL, 200),
                    new SystemTab("care-plans", "Care Plans", "ClipboardList", CLINICAL, 210),
                    new SystemTab("notes", "Notes", "BookOpen", CLINICAL, 220),
                    new SystemTab("longevity", "Longevity", "Timer", CLINICAL, 230));

    public List<SystemTab> tabs() {
        return TABS;
    }

    public Optional<SystemTab> find(String key) {
        return TABS.stream().filter(tab -> tab.key().equals(key)).findFirst();
    }

    /**
     * One catalog entry.
     *
     * @param key tab key
     * @param label default label
     * @param icon icon name understood by the client
     * @param category grouping
     * @param displayOrder default position
     */
    public record SystemTab(String key, String label, String icon, String category, int displayOrder) {

        /** The unsaved system-default record for this entry. */
        public TabRecord toRecord(boolean mandatory) {
            return new TabRecord(
                    null,
                    key,
                    label,
                    icon,
                    BUILTIN_COMPONENT,
                    category,
                    Map.of(),
                    TabScope.SYSTEM,
                    null,
                    null,
                    true,
                    mandatory,
                    true,
                    displayOrder,
                    null,
                    null,
                    null);
        }
    }
}
