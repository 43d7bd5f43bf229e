package sp.sistemaspalacios.api_attendance.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class PagedResponse<T> {

    private List<T> data;
    private Meta meta;

    @Data
    @AllArgsConstructor
    public static class Meta {
        private int page;
        private int limit;
        private long total;
        private int totalPages;
    }

    public static <T> PagedResponse<T> of(List<T> data, int page, int limit, long total) {
        int totalPages = (int) Math.ceil((double) total / limit);
        return new PagedResponse<>(data, new Meta(page, limit, total, totalPages));
    }
}
