package com.telelink.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telelink.scoring.config.ScoringProperties;
import com.telelink.scoring.dto.CustomerRecord;
import com.telelink.scoring.model.ModelRegistry;
import com.telelink.scoring.model.ModelRegistryLoader;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Fixtures {

  private Fixtures() {}

  /** Average customer: one service call, voicemail, no international plan. */
  public static CustomerRecord typical() {
    return CustomerRecord.builder()
        .accountLength(128).state("CA").areaCode("415")
        .internationalPlan(false).voiceMailPlan(true).numberOfVmailMessages(25)
        .totalDayMinutes(180.2).totalDayCalls(110).totalDayCharge(30.63)
        .totalEveMinutes(199.4).totalEveCalls(85).totalEveCharge(16.95)
        .totalNightMinutes(201.1).totalNightCalls(95).totalNightCharge(9.05)
        .totalIntlMinutes(10.1).totalIntlCalls(3).totalIntlCharge(2.73)
        .customerServiceCalls(1)
        .build();
  }

  /** New, barely active customer with no service calls and no international plan. */
  public static CustomerRecord lowUsage() {
    return CustomerRecord.builder()
        .accountLength(10).state("OH").areaCode("408")
        .internationalPlan(false).voiceMailPlan(false).numberOfVmailMessages(0)
        .totalDayMinutes(12.0).totalDayCalls(5).totalDayCharge(2.04)
        .totalEveMinutes(8.0).totalEveCalls(4).totalEveCharge(0.68)
        .totalNightMinutes(6.0).totalNightCalls(3).totalNightCharge(0.27)
        .totalIntlMinutes(0.5).totalIntlCalls(1).totalIntlCharge(0.14)
        .customerServiceCalls(0)
        .build();
  }

  /** Six service calls and no voicemail plan. */
  public static CustomerRecord frequentComplainer() {
    return typical().toBuilder()
        .voiceMailPlan(false).numberOfVmailMessages(0)
        .customerServiceCalls(6)
        .build();
  }

  /** International plan holder making several international calls: lands in the MEDIUM band. */
  public static CustomerRecord internationalCaller() {
    return typical().toBuilder()
        .internationalPlan(true).totalDayMinutes(150.0).totalIntlCalls(5)
        .build();
  }

  public static Map<String, Object> typicalJson() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("accountLength", 128);
    m.put("state", "CA");
    m.put("areaCode", "415");
    m.put("internationalPlan", "no");
    m.put("voiceMailPlan", "yes");
    m.put("numberOfVmailMessages", 25);
    m.put("totalDayMinutes", 180.2);
    m.put("totalDayCalls", 110);
    m.put("totalDayCharge", 30.63);
    m.put("totalEveMinutes", 199.4);
    m.put("totalEveCalls", 85);
    m.put("totalEveCharge", 16.95);
    m.put("totalNightMinutes", 201.1);
    m.put("totalNightCalls", 95);
    m.put("totalNightCharge", 9.05);
    m.put("totalIntlMinutes", 10.1);
    m.put("totalIntlCalls", 3);
    m.put("totalIntlCharge", 2.73);
    m.put("customerServiceCalls", 1);
    return m;
  }

  public static ModelRegistryLoader loader() {
    return new ModelRegistryLoader(new DefaultResourceLoader(), new ObjectMapper());
  }

  public static ModelRegistry bundledRegistry() {
    return loader().load(new ScoringProperties.Models());
  }
}
