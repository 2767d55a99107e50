package com.harvest.jobcrawler.crawl.util;

import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PostingUrlsTest {

    @Test
    void normalizeDropsQueryUnlessSourceKeysOnIt() {
        assertThat(PostingUrls.normalize("https://www.104.com.tw/job/7abc1?jobsource=list#top", SourcePlatform.PLATFORM_104))
            .isEqualTo("https://www.104.com.tw/job/7abc1");
        assertThat(PostingUrls.normalize("https://www.yes123.com.tw/job_refer.asp?p_id=20240101_01#x", SourcePlatform.PLATFORM_YES123))
            .isEqualTo("https://www.yes123.com.tw/job_refer.asp?p_id=20240101_01");
        assertThat(PostingUrls.normalize("   ", SourcePlatform.PLATFORM_104)).isNull();
    }

    @Test
    void normalizeAllDeduplicatesInOrderAndHonorsLimit() {
        List<String> urls = List.of(
            "https://www.1111.com.tw/job/100?a=1",
            "https://www.1111.com.tw/job/100",
            "https://www.1111.com.tw/job/200",
            "https://www.1111.com.tw/job/300"
        );

        assertThat(PostingUrls.normalizeAll(urls, SourcePlatform.PLATFORM_1111, 2))
            .containsExactly("https://www.1111.com.tw/job/100", "https://www.1111.com.tw/job/200");
        assertThat(PostingUrls.normalizeAll(urls, SourcePlatform.PLATFORM_1111, 0)).hasSize(3);
    }

    @Test
    void absolutizeResolvesRelativeLinks() {
        assertThat(PostingUrls.absolutize("//www.cake.me/jobs/x", "https://www.cake.me")).isEqualTo("https://www.cake.me/jobs/x");
        assertThat(PostingUrls.absolutize("/jobs/12", "https://www.yourator.co/")).isEqualTo("https://www.yourator.co/jobs/12");
        assertThat(PostingUrls.absolutize("job_refer.asp?p_id=1", "https://www.yes123.com.tw")).isEqualTo("https://www.yes123.com.tw/job_refer.asp?p_id=1");
    }

    @Test
    void sourceIdsFollowEachPlatformsUrlShape() {
        assertThat(PostingUrls.sourceIdFromUrl(SourcePlatform.PLATFORM_104, "https://www.104.com.tw/job/7abc1")).isEqualTo("7abc1");
        assertThat(PostingUrls.sourceIdFromUrl(SourcePlatform.PLATFORM_1111, "https://www.1111.com.tw/job/98765/")).isEqualTo("98765");
        assertThat(PostingUrls.sourceIdFromUrl(SourcePlatform.PLATFORM_YOURATOR, "https://www.yourator.co/companies/acme/jobs/123")).isEqualTo("123");
        assertThat(PostingUrls.sourceIdFromUrl(SourcePlatform.PLATFORM_YES123, "https://www.yes123.com.tw/x.asp?job_id=J9")).isEqualTo("J9");
        assertThat(PostingUrls.sourceIdFromUrl(SourcePlatform.PLATFORM_CAKERESUME, "https://www.cake.me/companies/acme/jobs/backend-dev/")).isEqualTo("backend-dev");
        assertThat(PostingUrls.companyIdFromUrl(SourcePlatform.PLATFORM_YOURATOR, "https://www.yourator.co/companies/acme/jobs/123")).isEqualTo("acme");
        assertThat(PostingUrls.sourceIdFromUrl(SourcePlatform.PLATFORM_104, "https://www.104.com.tw/company/a1")).isNull();
    }

    @Test
    void postingUrlsOnlyYieldOrganizationWhereTheCompanyIsInThePath() {
        assertThat(PostingUrls.companyIdFromPostingUrl(SourcePlatform.PLATFORM_YES123, "https://www.yes123.com.tw/job_refer.asp?p_id=20240101_J9"))
            .isNull();
        assertThat(PostingUrls.companyIdFromPostingUrl(SourcePlatform.PLATFORM_104, "https://www.104.com.tw/job/7abc1")).isNull();
        assertThat(PostingUrls.companyIdFromPostingUrl(SourcePlatform.PLATFORM_CAKERESUME, "https://www.cake.me/companies/acme/jobs/backend-dev"))
            .isEqualTo("acme");
        assertThat(PostingUrls.companyIdFromPostingUrl(SourcePlatform.PLATFORM_YOURATOR, "https://www.yourator.co/companies/acme/jobs/123"))
            .isEqualTo("acme");
        assertThat(PostingUrls.companyIdFromUrl(SourcePlatform.PLATFORM_YES123, "https://www.yes123.com.tw/wk_index/comp_info.asp?p_id=C77821"))
            .isEqualTo("C77821");
    }

    @Test
    void hostIsLowercasedAndNullForGarbage() {
        assertThat(PostingUrls.host("https://WWW.Cake.me/jobs")).isEqualTo("www.cake.me");
        assertThat(PostingUrls.host("not a url")).isNull();
    }
}
