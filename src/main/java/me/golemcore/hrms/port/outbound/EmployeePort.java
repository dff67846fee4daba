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
import java.util.Optional;

/**
 * Employee directory domain service.
 */
public interface EmployeePort {

    /**
     * Looks up an employee by code or (partial) name.
     */
    Map<String, Object> lookup(String query);

    List<Map<String, Object>> listByDepartment(String department);

    /**
     * Returns one page of active employees plus pagination metadata.
     */
    Map<String, Object> listAll(int page, int pageSize, String search);

    Map<String, Object> getCompanyStats();

    Optional<Map<String, Object>> findByEmpCode(String empCode);

    Map<String, Object> addEmployee(Map<String, Object> fields);

    Map<String, Object> updateEmployee(String empCode, Map<String, Object> updates);

    Map<String, Object> initiateResignation(String empCode, String resignationDate, String reason);

    void updateTaxRegime(String empCode, String taxRegime);
}
