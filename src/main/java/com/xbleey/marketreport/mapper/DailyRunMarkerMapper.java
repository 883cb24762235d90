package com.xbleey.marketreport.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.xbleey.marketreport.model.DailyRunMarker;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface DailyRunMarkerMapper extends BaseMapper<DailyRunMarker> {
}
