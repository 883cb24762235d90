package com.xbleey.marketreport.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@TableName("daily_run_marker")
public class DailyRunMarker {

    @TableId(value = "marker_id", type = IdType.INPUT)
    private String markerId;

    @TableField("last_run_date")
    private LocalDate lastRunDate;

    @TableField("updated_at")
    private Instant updatedAt;
}
