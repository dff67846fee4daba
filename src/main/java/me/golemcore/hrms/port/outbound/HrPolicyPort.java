package me.golemcore.hrms.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.List;
import java.util.Map;

/**
 * HR policy domain service: salary structure, leave entitlements and tax
 * configuration. All arithmetic happens behind this port.
 */
public interface HrPolicyPort {

    Map<String, Object> setPolicy(Map<String, Object> fields, String createdBy);

    Map<String, Object> getActivePolicy();

    List<Map<String, Object>> getPolicyHistory(int limit);

    Map<String, Object> computeSalaryBreakup(double annualCtc, String taxRegime);

    Map<String, Object> createPayrollFromCtc(String empCode, double annualCtc, String month);

    /**
     * Annual leave credits keyed by {@code casual_leave}, {@code sick_leave} and
     * {@code earned_leave}.
     */
    Map<String, Integer> getLeaveCredits();
}
