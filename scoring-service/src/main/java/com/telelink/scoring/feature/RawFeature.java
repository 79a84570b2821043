package com.telelink.scoring.feature;

import com.telelink.scoring.dto.CustomerRecord;

import java.util.function.Function;

/**
 * Non-categorical customer attributes in training column order, keyed by their training
 * feature names.
 */
public enum RawFeature {
  ACCOUNT_LENGTH("account_length", "accountLength", Kind.COUNT, CustomerRecord::accountLength),
  INTERNATIONAL_PLAN("international_plan", "internationalPlan", Kind.FLAG, CustomerRecord::internationalPlan),
  VOICE_MAIL_PLAN("voice_mail_plan", "voiceMailPlan", Kind.FLAG, CustomerRecord::voiceMailPlan),
  NUMBER_VMAIL_MESSAGES("number_vmail_messages", "numberOfVmailMessages", Kind.COUNT, CustomerRecord::numberOfVmailMessages),
  TOTAL_DAY_MINUTES("total_day_minutes", "totalDayMinutes", Kind.AMOUNT, CustomerRecord::totalDayMinutes),
  TOTAL_DAY_CALLS("total_day_calls", "totalDayCalls", Kind.COUNT, CustomerRecord::totalDayCalls),
  TOTAL_DAY_CHARGE("total_day_charge", "totalDayCharge", Kind.AMOUNT, CustomerRecord::totalDayCharge),
  TOTAL_EVE_MINUTES("total_eve_minutes", "totalEveMinutes", Kind.AMOUNT, CustomerRecord::totalEveMinutes),
  TOTAL_EVE_CALLS("total_eve_calls", "totalEveCalls", Kind.COUNT, CustomerRecord::totalEveCalls),
  TOTAL_EVE_CHARGE("total_eve_charge", "totalEveCharge", Kind.AMOUNT, CustomerRecord::totalEveCharge),
  TOTAL_NIGHT_MINUTES("total_night_minutes", "totalNightMinutes", Kind.AMOUNT, CustomerRecord::totalNightMinutes),
  TOTAL_NIGHT_CALLS("total_night_calls", "totalNightCalls", Kind.COUNT, CustomerRecord::totalNightCalls),
  TOTAL_NIGHT_CHARGE("total_night_charge", "totalNightCharge", Kind.AMOUNT, CustomerRecord::totalNightCharge),
  TOTAL_INTL_MINUTES("total_intl_minutes", "totalIntlMinutes", Kind.AMOUNT, CustomerRecord::totalIntlMinutes),
  TOTAL_INTL_CALLS("total_intl_calls", "totalIntlCalls", Kind.COUNT, CustomerRecord::totalIntlCalls),
  TOTAL_INTL_CHARGE("total_intl_charge", "totalIntlCharge", Kind.AMOUNT, CustomerRecord::totalIntlCharge),
  CUSTOMER_SERVICE_CALLS("customer_service_calls", "customerServiceCalls", Kind.COUNT, CustomerRecord::customerServiceCalls);

  enum Kind { COUNT, AMOUNT, FLAG }

  private final String featureName;
  private final String fieldName;
  private final Kind kind;
  private final Function<CustomerRecord, Object> extractor;

  RawFeature(String featureName, String fieldName, Kind kind, Function<CustomerRecord, Object> extractor) {
    this.featureName = featureName;
    this.fieldName = fieldName;
    this.kind = kind;
    this.extractor = extractor;
  }

  public String featureName() {
    return featureName;
  }

  /** Name of the {@link CustomerRecord} component, used in validation messages. */
  public String fieldName() {
    return fieldName;
  }

  Kind kind() {
    return kind;
  }

  Object extract(CustomerRecord record) {
    return extractor.apply(record);
  }

  public boolean isFlag() {
    return kind == Kind.FLAG;
  }
}
