package io.github.samzhu.timesheet.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.timesheet.config.TimesheetProperties;
import io.github.samzhu.timesheet.config.TimesheetProperties.FieldUnit;
import io.github.samzhu.timesheet.config.TimesheetProperties.FieldsConfig;
import io.github.samzhu.timesheet.dto.FieldIdentifier;
import io.github.samzhu.timesheet.dto.FieldValue;
import io.github.samzhu.timesheet.dto.ParseWarning;
import io.github.samzhu.timesheet.dto.ParsedTimeFields;
import io.github.samzhu.timesheet.dto.asana.AsanaTask;
import io.github.samzhu.timesheet.dto.asana.CustomField;

/**
 * 工時自訂欄位解析服務。
 *
 * <p>將 Asana 任務上格式不一的自訂欄位正規化為統一的工時指標 (單位：小時)：
 * <ul>
 *   <li>時間達成率：接受數字 ({@code 0.8}) 與百分比字串 ({@code "80%"})</li>
 *   <li>見積時間 / 實績時間：數字依設定單位換算；文字 ({@code "10h"}、{@code "90分"}) 依單位推定</li>
 * </ul>
 *
 * <h3>達成率欄位識別</h3>
 * <p>依序比對 {@link FieldIdentifier} 清單：先機器鍵 ({@link FieldIdentifier.Kind#CANONICAL})，
 * 再在地化名稱 ({@link FieldIdentifier.Kind#LOCALIZED})。兩者都有值且不一致時採用機器鍵，
 * 並記錄 {@link ParseWarning.Code#RATE_CONFLICT}。
 *
 * <h3>實績時間推導</h3>
 * <pre>
 * estimatedTime 與 rate 皆有值 → actualTime = estimatedTime × rate
 * 否則 actualTimeRaw 有值     → actualTime = actualTimeRaw
 * 否則                         → actualTime = null (見積なし)
 * </pre>
 *
 * <p>單一欄位格式錯誤不會拋出例外，只會記錄警告並視為無值。
 */
@Service
public class TimeFieldParser {

    private static final Logger log = LoggerFactory.getLogger(TimeFieldParser.class);

    private static final Pattern RATE_PATTERN = Pattern.compile("^([-+]?\\d+(?:\\.\\d+)?|[-+]?\\.\\d+)\\s*([%％]?)$");
    private static final Pattern DURATION_PATTERN = Pattern.compile(
        "([-+]?\\d*\\.?\\d+)\\s*(時間|分|hours?|hrs?|h|minutes?|mins?)?(?![a-z\\d])", Pattern.CASE_INSENSITIVE);

    private final List<FieldIdentifier> rateIdentifiers;
    private final List<FieldIdentifier> estimatedIdentifiers;
    private final List<FieldIdentifier> rawIdentifiers;
    private final FieldUnit estimatedUnit;
    private final FieldUnit rawUnit;

    public TimeFieldParser(TimesheetProperties properties) {
        FieldsConfig fields = properties.fields();
        this.rateIdentifiers = List.of(
            FieldIdentifier.canonical(fields.rateKey()),
            FieldIdentifier.localized(fields.rateLabel()));
        this.estimatedIdentifiers = fields.estimatedFieldNames().stream()
            .map(FieldIdentifier::localized)
            .toList();
        this.rawIdentifiers = fields.rawFieldNames().stream()
            .map(FieldIdentifier::localized)
            .toList();
        this.estimatedUnit = fields.estimatedUnit();
        this.rawUnit = fields.rawUnit();
        log.info("TimeFieldParser initialized: rate={}, estimated={}, raw={}",
            rateIdentifiers, fields.estimatedFieldNames(), fields.rawFieldNames());
    }

    /**
     * 解析完整的 Asana 任務。
     *
     * <p>見積時間由自訂欄位取得；實績時間優先採用 Asana 內建時間追蹤
     * ({@code actual_time_minutes})，沒有時才使用實績時間自訂欄位。
     *
     * @param task Asana 任務
     * @return 正規化後的工時欄位
     */
    public ParsedTimeFields parse(AsanaTask task) {
        List<CustomField> fields = task.customFieldsOrEmpty();
        FieldValue estimated = estimatedTime(fields);

        Double builtInRaw = null;
        if (task.actualTimeMinutes() != null && task.actualTimeMinutes() >= 0) {
            builtInRaw = FieldUnit.MINUTES.toHours(task.actualTimeMinutes());
        }

        ParsedTimeFields parsed = parse(fields, estimated.value(), builtInRaw);
        if (estimated.warning() == null) {
            return parsed;
        }
        List<ParseWarning> warnings = new ArrayList<>(parsed.warnings());
        warnings.add(0, estimated.warning());
        return new ParsedTimeFields(parsed.estimatedTime(), parsed.timeAchievementRate(),
            parsed.actualTimeRaw(), parsed.actualTime(), parsed.rateSource(), warnings);
    }

    /**
     * 依自訂欄位與見積時間推導工時。
     *
     * @param fields 自訂欄位
     * @param estimatedTime 見積時間 (小時)，可為 null
     * @return 正規化後的工時欄位
     */
    public ParsedTimeFields parse(List<CustomField> fields, Double estimatedTime) {
        return parse(fields, estimatedTime, null);
    }

    private ParsedTimeFields parse(List<CustomField> fields, Double estimatedTime, Double rawOverride) {
        List<ParseWarning> warnings = new ArrayList<>();

        FieldValue rate = timeAchievementRate(fields);
        if (rate.warning() != null) {
            warnings.add(rate.warning());
        }

        Double actualTimeRaw = rawOverride;
        if (actualTimeRaw == null) {
            FieldValue raw = durationField(fields, rawIdentifiers, rawUnit, ParseWarning.Code.RAW_UNPARSEABLE);
            if (raw.warning() != null) {
                warnings.add(raw.warning());
            }
            actualTimeRaw = raw.value();
        }

        Double actualTime;
        if (estimatedTime != null && rate.isPresent()) {
            actualTime = estimatedTime * rate.value();
        } else if (actualTimeRaw != null) {
            actualTime = actualTimeRaw;
        } else {
            actualTime = null;
        }

        if (!warnings.isEmpty()) {
            log.debug("Custom field warnings: {}", warnings);
        }
        return new ParsedTimeFields(estimatedTime, rate.value(), actualTimeRaw, actualTime, rate.source(), warnings);
    }

    /**
     * 取得見積時間 (小時)。
     *
     * @param fields 自訂欄位
     * @return 見積時間，找不到或格式錯誤時無值
     */
    public FieldValue estimatedTime(List<CustomField> fields) {
        return durationField(fields, estimatedIdentifiers, estimatedUnit, ParseWarning.Code.ESTIMATE_UNPARSEABLE);
    }

    /**
     * 取得時間達成率。
     *
     * <p>機器鍵與在地化名稱各自解析；兩者都有值時以機器鍵為準。
     *
     * @param fields 自訂欄位
     * @return 達成率
     */
    public FieldValue timeAchievementRate(List<CustomField> fields) {
        FieldValue chosen = FieldValue.absent();
        ParseWarning firstWarning = null;

        for (FieldIdentifier identifier : rateIdentifiers) {
            CustomField field = find(fields, identifier);
            if (field == null) {
                continue;
            }
            FieldValue candidate = parseRate(field, identifier.kind());
            if (!candidate.isPresent()) {
                if (firstWarning == null) {
                    firstWarning = candidate.warning();
                }
                continue;
            }
            if (!chosen.isPresent()) {
                chosen = candidate;
            } else if (Double.compare(chosen.value(), candidate.value()) != 0) {
                ParseWarning conflict = new ParseWarning(ParseWarning.Code.RATE_CONFLICT, field.name(),
                    chosen.value() + " vs " + candidate.value());
                log.warn("Rate fields disagree, using {} value: {}", chosen.source(), conflict);
                return new FieldValue(chosen.value(), chosen.source(), conflict);
            }
        }

        if (chosen.isPresent()) {
            return chosen;
        }
        return firstWarning != null ? FieldValue.rejected(firstWarning) : FieldValue.absent();
    }

    private FieldValue parseRate(CustomField field, FieldIdentifier.Kind kind) {
        Double value = field.numberValue();
        String raw = value != null ? value.toString() : firstText(field);
        if (value == null) {
            if (raw == null) {
                return FieldValue.absent();
            }
            value = parseRateText(raw);
            if (value == null) {
                return FieldValue.rejected(new ParseWarning(ParseWarning.Code.RATE_UNPARSEABLE, field.name(), raw));
            }
        }
        if (value.isNaN() || value.isInfinite()) {
            return FieldValue.rejected(new ParseWarning(ParseWarning.Code.RATE_UNPARSEABLE, field.name(), raw));
        }
        if (value < 0) {
            return FieldValue.rejected(new ParseWarning(ParseWarning.Code.RATE_NEGATIVE, field.name(), raw));
        }
        return FieldValue.of(value, kind);
    }

    /**
     * 解析達成率文字：{@code "0.8"} → 0.8，{@code "80%"} → 0.8，其他內容回傳 null。
     *
     * @param text 文字值
     * @return 達成率，無法解析時為 null
     */
    static Double parseRateText(String text) {
        Matcher matcher = RATE_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }
        double number = Double.parseDouble(matcher.group(1));
        return matcher.group(2).isEmpty() ? number : number / 100.0;
    }

    private FieldValue durationField(List<CustomField> fields, List<FieldIdentifier> identifiers,
            FieldUnit unit, ParseWarning.Code failureCode) {
        for (FieldIdentifier identifier : identifiers) {
            CustomField field = find(fields, identifier);
            if (field == null) {
                continue;
            }
            if (field.numberValue() != null) {
                double value = field.numberValue();
                if (value < 0 || value != value) {
                    return FieldValue.rejected(new ParseWarning(failureCode, field.name(), field.numberValue().toString()));
                }
                return FieldValue.of(unit.toHours(value), identifier.kind());
            }
            String text = firstText(field);
            if (text == null) {
                continue;
            }
            Double hours = parseDurationText(text, unit);
            if (hours == null || hours < 0) {
                return FieldValue.rejected(new ParseWarning(failureCode, field.name(), text));
            }
            return FieldValue.of(hours, identifier.kind());
        }
        return FieldValue.absent();
    }

    /**
     * 解析時間文字並換算為小時。
     *
     * <p>只看緊接在數字後的單位：{@code h}、{@code hours}、{@code 時間} 為小時；
     * {@code min}、{@code minutes}、{@code 分} 為分鐘；沒有單位時使用欄位設定的單位。
     * 例如 {@code "45min (short)"} 為 45 分鐘。
     *
     * @param text 文字值
     * @param defaultUnit 沒有單位時的預設單位
     * @return 小時數，無數字時為 null
     */
    static Double parseDurationText(String text, FieldUnit defaultUnit) {
        Matcher matcher = DURATION_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        double value = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2);
        if (unit == null) {
            return defaultUnit.toHours(value);
        }
        String lowered = unit.toLowerCase(Locale.ROOT);
        if (unit.equals("時間") || lowered.startsWith("h")) {
            return value;
        }
        return value / 60.0;
    }

    private static CustomField find(List<CustomField> fields, FieldIdentifier identifier) {
        for (CustomField field : fields) {
            if (identifier.matches(field)) {
                return field;
            }
        }
        return null;
    }

    private static String firstText(CustomField field) {
        if (field.textValue() != null && !field.textValue().isBlank()) {
            return field.textValue();
        }
        if (field.displayValue() != null && !field.displayValue().isBlank()) {
            return field.displayValue();
        }
        return null;
    }
}
