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
 * Leave management domain service.
 */
public interface LeavePort {

    List<Map<String, Object>> getLeaveRecords(String empCode, String status);

    Map<String, Object> applyLeave(String empCode, String leaveType, String startDate, String endDate,
            String reason);

    Map<String, Object> approveOrReject(String empCode, String startDate, String action, String approvedBy);

    /**
     * Credits an annual leave balance, e.g. for a newly joined employee.
     */
    void creditLeave(String empCode, String leaveType, int days, String reason);
}
