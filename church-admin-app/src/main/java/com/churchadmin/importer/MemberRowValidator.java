package com.churchadmin.importer;

import com.churchadmin.model.Household;
import com.churchadmin.model.Member;
import com.churchadmin.util.TextSanitizer;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Validates one member CSV row and decides which household the member lands in.
 *
 * Households are only planned here; the row that creates one carries it in {@link MemberRow#newHousehold()}
 * and it is written together with the members. A rejected row never creates or registers a household.
 */
public final class MemberRowValidator {

    public static final String FIRST_NAME_COLUMN = "first name";
    public static final String LAST_NAME_COLUMN = "last name";

    private static final Map<String, String[]> DATE_COLUMNS = new LinkedHashMap<>();

    static {
        DATE_COLUMNS.put("date of birth", new String[] {"date of birth"});
        DATE_COLUMNS.put("baptism date", new String[] {"baptism date"});
        DATE_COLUMNS.put("confirmation date", new String[] {"confirmation date"});
        DATE_COLUMNS.put("date received", new String[] {"date received"});
        DATE_COLUMNS.put("date removed", new String[] {"date removed"});
        DATE_COLUMNS.put("deceased date", new String[] {"deceased date"});
        DATE_COLUMNS.put("alternate address begin",
            new String[] {"alternate address begin", "household alternate address begin"});
        DATE_COLUMNS.put("alternate address end",
            new String[] {"alternate address end", "household alternate address end"});
    }

    private final HeaderIndex headers;
    private final ImportVocabulary vocabulary;
    private final Supplier<UUID> ids;

    public MemberRowValidator(HeaderIndex headers, ImportVocabulary vocabulary, Supplier<UUID> ids) {
        this.headers = headers;
        this.vocabulary = vocabulary;
        this.ids = ids;
    }

    public MemberRowValidator(HeaderIndex headers, ImportVocabulary vocabulary) {
        this(headers, vocabulary, UUID::randomUUID);
    }

    /**
     * Validates the row against {@code state}, registering its email and household group there when
     * the row is accepted.
     */
    public RowResult<MemberRow> validate(ImportRow row, MemberImportState state) {
        int line = row.lineNumber();

        String firstName = TextSanitizer.sanitizeText(row.value(headers, FIRST_NAME_COLUMN));
        String lastName = TextSanitizer.sanitizeText(row.value(headers, LAST_NAME_COLUMN));
        if (firstName == null || lastName == null) {
            return RowResult.rejected(line, "Missing required fields (First Name or Last Name)");
        }

        Map<String, LocalDate> dates = new LinkedHashMap<>();
        for (Map.Entry<String, String[]> column : DATE_COLUMNS.entrySet()) {
            String cell = row.value(headers, column.getValue());
            if (cell == null) continue;
            LocalDate date = ImportValues.parseDate(cell);
            if (date == null) {
                return RowResult.rejected(line, "Invalid " + column.getKey() + " (use YYYY-MM-DD)");
            }
            dates.put(column.getKey(), date);
        }

        String envelopeCell = row.value(headers, "envelope number");
        Integer envelope = ImportValues.parseInteger(envelopeCell);
        if (envelopeCell != null && envelope == null) {
            return RowResult.rejected(line, "Invalid envelope number");
        }

        String email1 = TextSanitizer.sanitizeEmail(row.value(headers, "email1", "email"));
        String email2 = TextSanitizer.sanitizeEmail(row.value(headers, "email2"));
        if (state.emailTaken(email1)) {
            return RowResult.rejected(line, "Email " + email1 + " already exists");
        }
        if (state.emailTaken(email2)) {
            return RowResult.rejected(line, "Email " + email2 + " already exists");
        }

        String token = row.value(headers, "household group");
        RowResult<HouseholdPlan> plan = planHousehold(row, state, token, firstName, lastName, dates);
        if (!plan.isAccepted()) {
            return plan.asRejection();
        }

        Member member = new Member(
            ids.get(),
            plan.value().householdId(),
            firstName,
            text(row, "middle name"),
            lastName,
            text(row, "suffix"),
            text(row, "preferred name"),
            text(row, "maiden name"),
            text(row, "title"),
            vocabulary.sex(row.value(headers, "sex")),
            dates.get("date of birth"),
            email1,
            email2,
            text(row, "phone home"),
            text(row, "phone cell1", "phone"),
            text(row, "phone cell2"),
            dates.get("baptism date"),
            dates.get("confirmation date"),
            vocabulary.receivedBy(row.value(headers, "received by")),
            dates.get("date received"),
            vocabulary.removedBy(row.value(headers, "removed by")),
            dates.get("date removed"),
            dates.get("deceased date"),
            text(row, "membership code"),
            envelope,
            vocabulary.participation(row.value(headers, "participation", "membership status")),
            vocabulary.sequenceRole(row.value(headers, "sequence"))
        );

        MemberRow accepted = new MemberRow(line, member, plan.value().newHousehold());
        state.accept(accepted, token);
        return RowResult.accepted(line, accepted);
    }

    private record HouseholdPlan(UUID householdId, Household newHousehold) {}

    private RowResult<HouseholdPlan> planHousehold(ImportRow row, MemberImportState state, String token,
                                                   String firstName, String lastName,
                                                   Map<String, LocalDate> dates) {
        int line = row.lineNumber();

        Optional<UUID> grouped = state.groups().find(token);
        if (grouped.isPresent()) {
            return RowResult.accepted(line, new HouseholdPlan(grouped.get(), null));
        }

        String householdName = text(row, "household name");
        if (ImportValues.parseFlag(row.value(headers, "create new household"))) {
            Household created = newHousehold(row, householdName, dates);
            return RowResult.accepted(line, new HouseholdPlan(created.id(), created));
        }

        String householdIdCell = row.value(headers, "household id");
        if (householdIdCell != null) {
            UUID householdId = ImportValues.parseUuid(householdIdCell);
            if (householdId == null || !state.householdExists(householdId)) {
                return RowResult.rejected(line, "Household ID " + householdIdCell + " not found");
            }
            return RowResult.accepted(line, new HouseholdPlan(householdId, null));
        }

        // names are required, so the member's name is always available as a fallback
        String name = householdName != null ? householdName : firstName + " " + lastName;
        Household created = newHousehold(row, name, dates);
        return RowResult.accepted(line, new HouseholdPlan(created.id(), created));
    }

    private Household newHousehold(ImportRow row, String name, Map<String, LocalDate> dates) {
        return new Household(
            ids.get(),
            name,
            vocabulary.householdType(row.value(headers, "household type")),
            ImportValues.parseFlag(row.value(headers, "is non household")),
            text(row, "person assigned"),
            text(row, "ministry group"),
            text(row, "household address1", "address1"),
            text(row, "household address2", "address2"),
            text(row, "household city", "city"),
            text(row, "household state", "state"),
            text(row, "household zip", "zip"),
            text(row, "household country", "country"),
            dates.get("alternate address begin"),
            dates.get("alternate address end")
        );
    }

    private String text(ImportRow row, String... names) {
        return TextSanitizer.sanitizeText(row.value(headers, names));
    }
}
