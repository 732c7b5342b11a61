package io.github.samzhu.timesheet.dto.asana;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asana 分頁回應。
 *
 * <p>{@code next_page} 為 null 表示已是最後一頁。
 *
 * @param data 本頁資料
 * @param nextPage 下一頁游標
 * @param <T> 資料型別
 * @see <a href="https://developers.asana.com/docs/pagination">Asana Pagination</a>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsanaPage<T>(
    List<T> data,
    @JsonProperty("next_page") NextPage nextPage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NextPage(String offset) {}

    /**
     * 下一頁的 offset，沒有下一頁時回傳 null。
     */
    public String nextOffset() {
        if (nextPage == null || nextPage.offset() == null || nextPage.offset().isBlank()) {
            return null;
        }
        return nextPage.offset();
    }

    public List<T> dataOrEmpty() {
        return data != null ? data : List.of();
    }
}
