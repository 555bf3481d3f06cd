package com.localguide.repository.projection;

import com.localguide.entity.FoodItem;
import com.localguide.entity.FoodVendor;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * (벤더, 메뉴) 쌍. 추천 1건의 원천 데이터
 */
@Getter
@AllArgsConstructor
public class VendorOffering {
    private final FoodVendor vendor;
    private final FoodItem item;
}
