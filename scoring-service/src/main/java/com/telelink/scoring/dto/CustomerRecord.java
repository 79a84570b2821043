package com.telelink.scoring.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Raw customer attributes as submitted for scoring. Components are boxed so that an absent
 * field stays distinguishable from zero; the feature encoder rejects nulls.
 */
public record CustomerRecord(
    Integer accountLength,
    String state,
    String areaCode,
    @JsonDeserialize(using = YesNoBooleanDeserializer.class) Boolean internationalPlan,
    @JsonDeserialize(using = YesNoBooleanDeserializer.class) Boolean voiceMailPlan,
    Integer numberOfVmailMessages,
    Double totalDayMinutes,
    Integer totalDayCalls,
    Double totalDayCharge,
    Double totalEveMinutes,
    Integer totalEveCalls,
    Double totalEveCharge,
    Double totalNightMinutes,
    Integer totalNightCalls,
    Double totalNightCharge,
    Double totalIntlMinutes,
    Integer totalIntlCalls,
    Double totalIntlCharge,
    Integer customerServiceCalls) {

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.accountLength = accountLength;
    b.state = state;
    b.areaCode = areaCode;
    b.internationalPlan = internationalPlan;
    b.voiceMailPlan = voiceMailPlan;
    b.numberOfVmailMessages = numberOfVmailMessages;
    b.totalDayMinutes = totalDayMinutes;
    b.totalDayCalls = totalDayCalls;
    b.totalDayCharge = totalDayCharge;
    b.totalEveMinutes = totalEveMinutes;
    b.totalEveCalls = totalEveCalls;
    b.totalEveCharge = totalEveCharge;
    b.totalNightMinutes = totalNightMinutes;
    b.totalNightCalls = totalNightCalls;
    b.totalNightCharge = totalNightCharge;
    b.totalIntlMinutes = totalIntlMinutes;
    b.totalIntlCalls = totalIntlCalls;
    b.totalIntlCharge = totalIntlCharge;
    b.customerServiceCalls = customerServiceCalls;
    return b;
  }

  public static final class Builder {
    private Integer accountLength;
    private String state;
    private String areaCode;
    private Boolean internationalPlan;
    private Boolean voiceMailPlan;
    private Integer numberOfVmailMessages;
    private Double totalDayMinutes;
    private Integer totalDayCalls;
    private Double totalDayCharge;
    private Double totalEveMinutes;
    private Integer totalEveCalls;
    private Double totalEveCharge;
    private Double totalNightMinutes;
    private Integer totalNightCalls;
    private Double totalNightCharge;
    private Double totalIntlMinutes;
    private Integer totalIntlCalls;
    private Double totalIntlCharge;
    private Integer customerServiceCalls;

    private Builder() {}

    public Builder accountLength(Integer v) { this.accountLength = v; return this; }
    public Builder state(String v) { this.state = v; return this; }
    public Builder areaCode(String v) { this.areaCode = v; return this; }
    public Builder internationalPlan(Boolean v) { this.internationalPlan = v; return this; }
    public Builder voiceMailPlan(Boolean v) { this.voiceMailPlan = v; return this; }
    public Builder numberOfVmailMessages(Integer v) { this.numberOfVmailMessages = v; return this; }
    public Builder totalDayMinutes(Double v) { this.totalDayMinutes = v; return this; }
    public Builder totalDayCalls(Integer v) { this.totalDayCalls = v; return this; }
    public Builder totalDayCharge(Double v) { this.totalDayCharge = v; return this; }
    public Builder totalEveMinutes(Double v) { this.totalEveMinutes = v; return this; }
    public Builder totalEveCalls(Integer v) { this.totalEveCalls = v; return this; }
    public Builder totalEveCharge(Double v) { this.totalEveCharge = v; return this; }
    public Builder totalNightMinutes(Double v) { this.totalNightMinutes = v; return this; }
    public Builder totalNightCalls(Integer v) { this.totalNightCalls = v; return this; }
    public Builder totalNightCharge(Double v) { this.totalNightCharge = v; return this; }
    public Builder totalIntlMinutes(Double v) { this.totalIntlMinutes = v; return this; }
    public Builder totalIntlCalls(Integer v) { this.totalIntlCalls = v; return this; }
    public Builder totalIntlCharge(Double v) { this.totalIntlCharge = v; return this; }
    public Builder customerServiceCalls(Integer v) { this.customerServiceCalls = v; return this; }

    public CustomerRecord build() {
      return new CustomerRecord(accountLength, state, areaCode, internationalPlan, voiceMailPlan,
          numberOfVmailMessages, totalDayMinutes, totalDayCalls, totalDayCharge,
          totalEveMinutes, totalEveCalls, totalEveCharge, totalNightMinutes, totalNightCalls,
          totalNightCharge, totalIntlMinutes, totalIntlCalls, totalIntlCharge, customerServiceCalls);
    }
  }
}
